/*
 * QualityListParser.java
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
import org.bluezoo.fieldparse.Parameter;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.Tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Parser for the Accept-Charset, Accept-Encoding and Accept-Language
 * headers: comma-separated lists of tokens with optional qualities.
 * <p>
 * The tokens are returned without their qualities, in preference
 * order. The wildcard {@code *} ranks below any other token of the same
 * quality. Tokens with a quality of 0 are kept at the end of the list.
 * Charsets and content codings are case insensitive and are returned
 * in lower case; language tags are returned as given.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-12.5'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class QualityListParser {

	private static final Logger LOGGER = Logger.getLogger(QualityListParser.class.getName());

	private QualityListParser() {
		// Static utility class
	}

	/**
	 * Parses an Accept-Charset header.
	 * @param value the header value
	 * @return the charsets in preference order
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static List<String> parseAcceptCharset(String value) throws MalformedValueException {
		return parseAcceptCharset(value, false);
	}

	/**
	 * Parses an Accept-Charset header.
	 * @param value the header value
	 * @param strict whether an element that cannot be understood fails
	 * the parse
	 * @return the charsets in preference order
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<String> parseAcceptCharset(String value, boolean strict) throws MalformedValueException {
		return parse("Accept-Charset", value, ScanOptions.DEFAULT.withLowercaseValues(true).withStrict(strict));
	}

	/**
	 * Parses an Accept-Encoding header.
	 * @param value the header value
	 * @return the content codings in preference order
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static List<String> parseAcceptEncoding(String value) throws MalformedValueException {
		return parseAcceptEncoding(value, false);
	}

	/**
	 * Parses an Accept-Encoding header.
	 * @param value the header value
	 * @param strict whether an element that cannot be understood fails
	 * the parse
	 * @return the content codings in preference order
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<String> parseAcceptEncoding(String value, boolean strict) throws MalformedValueException {
		return parse("Accept-Encoding", value, ScanOptions.DEFAULT.withLowercaseValues(true).withStrict(strict));
	}

	/**
	 * Parses an Accept-Language header.
	 * @param value the header value
	 * @return the language ranges in preference order
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static List<String> parseAcceptLanguage(String value) throws MalformedValueException {
		return parseAcceptLanguage(value, false);
	}

	/**
	 * Parses an Accept-Language header.
	 * @param value the header value
	 * @param strict whether an element that cannot be understood fails
	 * the parse
	 * @return the language ranges in preference order
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<String> parseAcceptLanguage(String value, boolean strict) throws MalformedValueException {
		return parse("Accept-Language", value, ScanOptions.DEFAULT.withStrict(strict));
	}

	/**
	 * Parses a qualified token list.
	 * @param headerName the header name to report in errors
	 * @param value the header value
	 * @param options the scan options; {@code lowercaseValues} folds the
	 * tokens to lower case
	 * @return the tokens in preference order
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<String> parse(String headerName, String value, ScanOptions options) throws MalformedValueException {
		return parseWithWarnings(headerName, value, options).getValueOrThrow(headerName, value);
	}

	/**
	 * Parses a qualified token list without throwing.
	 * @param headerName the header name to report in warnings
	 * @param value the header value
	 * @param options the scan options
	 * @return the tokens with a warning for each element that was
	 * skipped, or a failure
	 */
	public static ParseResult<List<String>> parseWithWarnings(String headerName, String value, ScanOptions options) {
		boolean strict = options.isStrict();
		ParseResult<List<String>> split = ListParser.split(value, options);
		if (!split.isSuccess()) {
			return split;
		}
		List<String> warnings = new ArrayList<>();
		List<QualityValue<String>> tokens = new ArrayList<>();
		int position = 0;
		for (String element : split.getValue()) {
			int semicolonIndex = ParameterParser.indexOfDelimiter(element, ';', 0, options);
			String token = (semicolonIndex < 0 ? element : element.substring(0, semicolonIndex)).trim();
			if (!Tokens.isToken(token)) {
				String reason = SkippedElements.message("warn.invalid_token", token);
				if (strict) {
					return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION,
							SkippedElements.message("warn.skipped", headerName, element, reason));
				}
				SkippedElements.record(LOGGER, headerName, element, reason, warnings);
				continue;
			}
			if (options.isLowercaseValues()) {
				token = token.toLowerCase(Locale.ROOT);
			}
			double quality = 1.0;
			boolean explicit = false;
			if (semicolonIndex >= 0) {
				ParseResult<List<Parameter>> scanned = ParameterParser.scan(headerName, element.substring(semicolonIndex + 1), options);
				if (!scanned.isSuccess()) {
					if (strict) {
						return SkippedElements.strictFailure(headerName, element, scanned);
					}
					SkippedElements.record(LOGGER, headerName, element, scanned.getFailureMessage(), warnings);
					continue;
				}
				warnings.addAll(scanned.getWarnings());
				String q = null;
				for (Parameter parameter : scanned.getValue()) {
					if ("q".equals(parameter.getName())) {
						q = parameter.getValue();
					}
				}
				if (q != null) {
					ParseResult<Double> parsedQuality = QualityValue.parseQuality(q, strict);
					if (!parsedQuality.isSuccess()) {
						if (strict) {
							return SkippedElements.strictFailure(headerName, element, parsedQuality);
						}
						SkippedElements.record(LOGGER, headerName, element, parsedQuality.getFailureMessage(), warnings);
						continue;
					}
					warnings.addAll(parsedQuality.getWarnings());
					quality = parsedQuality.getValue();
					explicit = quality == 1.0;
				}
			}
			int specificity = "*".equals(token) ? 0 : 1;
			tokens.add(new QualityValue<>(token, quality, explicit, specificity, position++));
		}
		return ParseResult.success(QualityValue.sort(tokens), warnings);
	}

}
