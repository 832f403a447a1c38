/*
 * ParseResult.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of parsing a header field value.
 * <p>
 * A successful result carries the parsed value together with a warning
 * for every element that lenient parsing skipped. A failed result
 * carries the kind of failure and a message. Parsers produce these
 * results internally and convert failures into exceptions only at their
 * public entry points, using {@link #getValueOrThrow}.
 *
 * @param <T> the type of the parsed value
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ParseResult<T> {

	/**
	 * The kind of failure.
	 */
	public enum Kind {

		/** The value does not conform to the header grammar. */
		MALFORMED_VALUE,

		/** A parameter list could not be scanned. */
		MALFORMED_PARAMETER_LIST,

		/** Strict mode promoted a skipped element to a failure. */
		STRICT_VIOLATION;

	}

	private final T value;
	private final List<String> warnings;
	private final Kind kind;
	private final String message;

	private ParseResult(T value, List<String> warnings, Kind kind, String message) {
		this.value = value;
		this.warnings = warnings;
		this.kind = kind;
		this.message = message;
	}

	/**
	 * Returns a successful result without warnings.
	 * @param value the parsed value
	 * @return the result
	 */
	public static <T> ParseResult<T> success(T value) {
		return new ParseResult<>(value, Collections.<String>emptyList(), null, null);
	}

	/**
	 * Returns a successful result.
	 * @param value the parsed value
	 * @param warnings descriptions of the elements that were skipped
	 * @return the result
	 */
	public static <T> ParseResult<T> success(T value, List<String> warnings) {
		if (warnings == null || warnings.isEmpty()) {
			return success(value);
		}
		return new ParseResult<>(value, Collections.unmodifiableList(new ArrayList<>(warnings)), null, null);
	}

	/**
	 * Returns a failed result.
	 * @param kind the kind of failure
	 * @param message the reason for the failure
	 * @return the result
	 */
	public static <T> ParseResult<T> failure(Kind kind, String message) {
		if (kind == null || message == null) {
			throw new NullPointerException("kind and message must not be null");
		}
		return new ParseResult<>(null, Collections.<String>emptyList(), kind, message);
	}

	/**
	 * Indicates whether parsing succeeded.
	 * @return true for a successful result
	 */
	public boolean isSuccess() {
		return kind == null;
	}

	/**
	 * Returns the parsed value.
	 * @return the value
	 * @exception IllegalStateException if this is a failed result
	 */
	public T getValue() {
		if (kind != null) {
			throw new IllegalStateException(message);
		}
		return value;
	}

	/**
	 * Returns the warnings recorded for skipped elements.
	 * @return an unmodifiable list, empty if nothing was skipped
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Returns the kind of failure.
	 * @return the failure kind, or null for a successful result
	 */
	public Kind getFailureKind() {
		return kind;
	}

	/**
	 * Returns the failure message.
	 * @return the message, or null for a successful result
	 */
	public String getFailureMessage() {
		return message;
	}

	/**
	 * Returns the value, or throws the exception corresponding to the
	 * failure kind.
	 * @param headerName the header name to report
	 * @param headerValue the header value to report
	 * @return the parsed value
	 * @exception MalformedParameterListException for MALFORMED_PARAMETER_LIST
	 * @exception StrictModeViolationException for STRICT_VIOLATION
	 * @exception MalformedValueException for MALFORMED_VALUE
	 */
	public T getValueOrThrow(String headerName, String headerValue) throws MalformedValueException {
		if (kind == null) {
			return value;
		}
		switch (kind) {
			case MALFORMED_PARAMETER_LIST:
				throw new MalformedParameterListException(headerName, headerValue, message);
			case STRICT_VIOLATION:
				throw new StrictModeViolationException(headerName, headerValue, message);
			default:
				throw new MalformedValueException(headerName, headerValue, message);
		}
	}

	@Override
	public String toString() {
		if (kind != null) {
			return "ParseResult[" + kind + ": " + message + "]";
		}
		return "ParseResult[" + value + ", warnings=" + warnings + "]";
	}

}
