/*
 * ListParser.java
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

package org.bluezoo.fieldparse.parser;

import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.Tokens;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitter for comma-separated header lists.
 * Commas inside quoted-strings do not separate elements. Elements are
 * trimmed and empty elements are dropped, as RFC 9110 requires of
 * recipients.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-5.6.1'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ListParser {

	static final String HEADER_NAME = "List";

	private ListParser() {
		// Static utility class
	}

	/**
	 * Parses a comma-separated list. Elements that are entirely a
	 * quoted-string are unquoted.
	 * @param value the header value
	 * @return the list elements
	 * @exception MalformedValueException if a quoted-string is not
	 * terminated
	 */
	public static List<String> parse(String value) throws MalformedValueException {
		List<String> elements = split(value);
		List<String> result = new ArrayList<>(elements.size());
		for (String element : elements) {
			result.add(Tokens.unquote(element));
		}
		return result;
	}

	/**
	 * Splits a comma-separated list, keeping the raw text of each
	 * element.
	 * @param value the header value
	 * @return the list elements
	 * @exception MalformedValueException if a quoted-string is not
	 * terminated
	 */
	public static List<String> split(String value) throws MalformedValueException {
		return split(value, ScanOptions.DEFAULT).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Splits a comma-separated list without throwing.
	 * @param value the header value
	 * @param options whether quoted-strings and comments protect commas
	 * @return the raw elements, or a failure
	 */
	static ParseResult<List<String>> split(String value, ScanOptions options) {
		if (value == null) {
			throw new NullPointerException("value must not be null");
		}
		List<String> elements = new ArrayList<>();
		boolean quoted = false;
		int depth = 0;
		int start = 0;
		int len = value.length();
		for (int i = 0; i < len; i++) {
			char c = value.charAt(i);
			if (quoted) {
				if (c == '\\') {
					i++;
				} else if (c == '"') {
					quoted = false;
				}
			} else if (depth > 0) {
				if (c == '\\') {
					i++;
				} else if (c == '(') {
					depth++;
				} else if (c == ')') {
					depth--;
				}
			} else if (c == '"' && options.isQuoteAware()) {
				quoted = true;
			} else if (c == '(' && options.isCommentAware()) {
				depth = 1;
			} else if (c == ',') {
				add(elements, value.substring(start, i));
				start = i + 1;
			}
		}
		if (quoted) {
			return ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE,
					SkippedElements.message("err.unterminated_quote"));
		}
		if (depth > 0) {
			return ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE,
					SkippedElements.message("err.unterminated_comment"));
		}
		add(elements, value.substring(start));
		return ParseResult.success(elements);
	}

	private static void add(List<String> elements, String element) {
		String trimmed = element.trim();
		if (!trimmed.isEmpty()) {
			elements.add(trimmed);
		}
	}

}
