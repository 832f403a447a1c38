/*
 * LinkParser.java
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

import org.bluezoo.fieldparse.LinkHeader;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.Parameter;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.Tokens;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parser for the Link header.
 * <p>
 * Each link is a target in angle brackets followed by optional
 * semicolon-separated parameters. Commas and semicolons inside
 * quoted-strings belong to the parameter value. Whitespace around '='
 * is tolerated and parameters without a value are allowed.
 * Syntax errors in the bracketed target or the parameter list always
 * fail the parse; strict mode additionally rejects parameters that
 * lenient parsing would skip.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc8288#section-3'>RFC 8288</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LinkParser {

	private static final Logger LOGGER = Logger.getLogger(LinkParser.class.getName());

	static final String HEADER_NAME = "Link";

	private static final Set<String> SINGLE_VALUED =
		Collections.unmodifiableSet(new HashSet<>(Arrays.asList("rel", "media", "type", "title", "title*")));

	private LinkParser() {
		// Static utility class
	}

	/**
	 * Parses a Link header, keeping the first of any repeated
	 * single-valued parameter.
	 * @param value the header value
	 * @return the links in order of appearance
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<LinkHeader> parse(String value) throws MalformedValueException {
		return parse(value, LinkParameterPolicy.FIRST_WINS, false);
	}

	/**
	 * Parses a Link header, keeping the first of any repeated
	 * single-valued parameter.
	 * @param value the header value
	 * @param strict whether a parameter that cannot be understood fails
	 * the parse
	 * @return the links in order of appearance
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<LinkHeader> parse(String value, boolean strict) throws MalformedValueException {
		return parse(value, LinkParameterPolicy.FIRST_WINS, strict);
	}

	/**
	 * Parses a Link header.
	 * @param value the header value
	 * @param policy how repeated parameters are combined
	 * @param strict whether a parameter that cannot be understood fails
	 * the parse
	 * @return the links in order of appearance
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<LinkHeader> parse(String value, LinkParameterPolicy policy, boolean strict)
			throws MalformedValueException {
		return parseWithWarnings(value, policy, strict).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Parses a Link header without throwing.
	 * @param value the header value
	 * @param policy how repeated parameters are combined
	 * @param strict whether a parameter that cannot be understood fails
	 * the parse
	 * @return the links with a warning for each parameter that was
	 * skipped, or a failure
	 */
	public static ParseResult<List<LinkHeader>> parseWithWarnings(String value, LinkParameterPolicy policy,
			boolean strict) {
		if (value == null || policy == null) {
			throw new NullPointerException("value and policy must not be null");
		}
		ScanOptions options = ScanOptions.LINK.withStrict(strict);
		List<String> warnings = new ArrayList<>();
		List<LinkHeader> links = new ArrayList<>();
		int len = value.length();
		int pos = skipSeparators(value, 0);
		while (pos < len) {
			if (value.charAt(pos) != '<') {
				return malformed("err.missing_open_bracket");
			}
			int end = value.indexOf('>', pos + 1);
			if (end < 0) {
				return malformed("err.missing_close_bracket");
			}
			String target = value.substring(pos + 1, end).trim();
			if (target.isEmpty()) {
				return malformed("err.empty_target");
			}
			pos = end + 1;
			int commaIndex = Tokens.indexOfUnquoted(value, ',', pos);
			int elementEnd = (commaIndex < 0) ? len : commaIndex;
			String params = value.substring(pos, elementEnd).trim();
			if (!params.isEmpty() && params.charAt(0) != ';') {
				return malformed("err.missing_semicolon");
			}
			ParseResult<List<Parameter>> scanned = ParameterParser.scan(HEADER_NAME, params, options);
			if (!scanned.isSuccess()) {
				return ParseResult.failure(scanned.getFailureKind(), scanned.getFailureMessage());
			}
			warnings.addAll(scanned.getWarnings());
			List<Parameter> parameters = scanned.getValue();
			if (policy == LinkParameterPolicy.FIRST_WINS) {
				parameters = firstWins(target, parameters);
			}
			links.add(new LinkHeader(target, parameters));
			pos = skipSeparators(value, elementEnd);
		}
		return ParseResult.success(Collections.unmodifiableList(links), warnings);
	}

	private static List<Parameter> firstWins(String target, List<Parameter> parameters) {
		Set<String> seen = new HashSet<>();
		List<Parameter> result = new ArrayList<>(parameters.size());
		for (Parameter parameter : parameters) {
			String name = parameter.getName();
			if (SINGLE_VALUED.contains(name) && !seen.add(name)) {
				if (LOGGER.isLoggable(Level.FINE)) {
					String message = SkippedElements.L10N.getString("log.ignored_repeat");
					LOGGER.fine(MessageFormat.format(message, HEADER_NAME, name, target));
				}
				continue;
			}
			result.add(parameter);
		}
		return result;
	}

	private static int skipSeparators(String value, int pos) {
		while (pos < value.length()) {
			char c = value.charAt(pos);
			if (c != ',' && !Tokens.isWhitespace(c)) {
				break;
			}
			pos++;
		}
		return pos;
	}

	private static ParseResult<List<LinkHeader>> malformed(String key) {
		return ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE, SkippedElements.message(key));
	}

}
