/*
 * StrictModeViolationException.java
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
 * Raised in strict mode for an element that lenient parsing would have
 * skipped.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StrictModeViolationException extends MalformedValueException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructs a new exception.
	 * @param headerName the name of the header being parsed
	 * @param headerValue the value that could not be parsed
	 * @param message the reason the element was rejected
	 */
	public StrictModeViolationException(String headerName, String headerValue, String message) {
		super(headerName, headerValue, message);
	}

}
