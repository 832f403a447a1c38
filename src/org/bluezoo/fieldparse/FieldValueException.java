/*
 * FieldValueException.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of fieldparse, a library for parsing structured
 * HTTP and MIME header field values.
 *
 * fieldparse is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * fieldparse is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with fieldparse.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fieldparse;

/**
 * Superclass of the exceptions raised when a header field value cannot
 * be parsed or a negotiation cannot be satisfied.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FieldValueException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructs a new exception with the specified message.
	 * @param message the detail message
	 */
	public FieldValueException(String message) {
		super(message);
	}

	/**
	 * Constructs a new exception with the specified message and cause.
	 * @param message the detail message
	 * @param cause the cause of this exception
	 */
	public FieldValueException(String message, Throwable cause) {
		super(message, cause);
	}

}
