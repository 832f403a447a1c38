/*
 * CacheControlParser.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parser for the Cache-Control header.
 * <p>
 * Each directive maps to {@link Boolean#TRUE} when it has no argument,
 * to a {@link Long} when its argument is a delta-seconds value, and to
 * the unquoted {@link String} argument otherwise. Directive names are
 * folded to lower case; when a directive is repeated the last
 * occurrence wins.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9111#section-5.2'>RFC 9111</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CacheControlParser {

	private static final Logger LOGGER = Logger.getLogger(CacheControlParser.class.getName());

	static final String HEADER_NAME = "Cache-Control";

	/**
	 * Delta-seconds larger than this are replaced by it (RFC 9111
	 * section 1.2.2).
	 */
	public static final long MAX_DELTA_SECONDS = 2147483648L;

	private CacheControlParser() {
		// Static utility class
	}

	/**
	 * Parses a Cache-Control header, skipping directives that cannot
	 * be understood.
	 * @param value the header value
	 * @return the directives in order of appearance
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static Map<String, Object> parse(String value) throws MalformedValueException {
		return parse(value, false);
	}

	/**
	 * Parses a Cache-Control header.
	 * @param value the header value
	 * @param strict whether a directive that cannot be understood fails
	 * the parse
	 * @return the directives in order of appearance
	 * @exception MalformedValueException if the value is malformed
	 */
	public static Map<String, Object> parse(String value, boolean strict) throws MalformedValueException {
		return parseWithWarnings(value, strict).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Parses a Cache-Control header without throwing.
	 * @param value the header value
	 * @param strict whether a directive that cannot be understood fails
	 * the parse
	 * @return the directives with a warning for each directive that was
	 * skipped, or a failure
	 */
	public static ParseResult<Map<String, Object>> parseWithWarnings(String value, boolean strict) {
		ParseResult<List<String>> split = ListParser.split(value, ScanOptions.DEFAULT);
		if (!split.isSuccess()) {
			return ParseResult.failure(split.getFailureKind(), split.getFailureMessage());
		}
		List<String> warnings = new ArrayList<>();
		Map<String, Object> directives = new LinkedHashMap<>();
		for (String element : split.getValue()) {
			int equalsIndex = Tokens.indexOfUnquoted(element, '=', 0);
			String name = (equalsIndex < 0 ? element : element.substring(0, equalsIndex)).trim();
			String reason = null;
			Object argument = Boolean.TRUE;
			if (!Tokens.isToken(name)) {
				reason = SkippedElements.message("warn.invalid_directive");
			} else if (equalsIndex >= 0) {
				String raw = element.substring(equalsIndex + 1).trim();
				if (raw.isEmpty()) {
					reason = SkippedElements.message("warn.empty_value");
				} else {
					argument = toArgument(Tokens.unquote(raw));
				}
			}
			if (reason != null) {
				if (strict) {
					return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION,
							SkippedElements.message("warn.skipped", HEADER_NAME, element, reason));
				}
				SkippedElements.record(LOGGER, HEADER_NAME, element, reason, warnings);
				continue;
			}
			name = name.toLowerCase(Locale.ROOT);
			directives.remove(name);
			directives.put(name, argument);
		}
		return ParseResult.success(Collections.unmodifiableMap(directives), warnings);
	}

	private static Object toArgument(String s) {
		if (s.isEmpty()) {
			return s;
		}
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c < '0' || c > '9') {
				return s;
			}
		}
		if (s.length() > 10) {
			return MAX_DELTA_SECONDS;
		}
		return Math.min(Long.parseLong(s), MAX_DELTA_SECONDS);
	}

}
