/*
 * MalformedValueException.java
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
 * An exception indicating that a header field value does not conform
 * to the grammar of its header.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MalformedValueException extends FieldValueException {

	private static final long serialVersionUID = 1L;

	private final String headerName;
	private final String headerValue;

	/**
	 * Constructs a new exception.
	 * @param headerName the name of the header being parsed
	 * @param headerValue the value that could not be parsed
	 * @param message the reason the value was rejected
	 */
	public MalformedValueException(String headerName, String headerValue, String message) {
		super(formatMessage(headerName, headerValue, message));
		this.headerName = headerName;
		this.headerValue = headerValue;
	}

	/**
	 * Returns the name of the header being parsed, e.g. "Content-Type".
	 * @return the header name
	 */
	public String getHeaderName() {
		return headerName;
	}

	/**
	 * Returns the header value that was rejected.
	 * @return the header value
	 */
	public String getHeaderValue() {
		return headerValue;
	}

	private static String formatMessage(String headerName, String headerValue, String message) {
		return String.format("%s: %s (%s)", headerName, message, headerValue);
	}

}
