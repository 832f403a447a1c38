/*
 * ContentTypeParser.java
 * Copyright (C) 2005, 2025 Chris Burdess
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

import org.bluezoo.fieldparse.ContentType;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.Parameter;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.Tokens;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for MIME Content-Type header values.
 * <p>
 * Comments are discarded wherever RFC 2045 permits them. A
 * structured-syntax suffix is split off at the last '+' of the subtype.
 * When a parameter is repeated the last occurrence wins.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc2045#section-5'>RFC 2045</a>
 * @see <a href='https://www.rfc-editor.org/rfc/rfc6839'>RFC 6839</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentTypeParser {

	static final String HEADER_NAME = "Content-Type";

	private ContentTypeParser() {
		// Static utility class
	}

	/**
	 * Parses a Content-Type header value. Parameters that cannot be
	 * understood are skipped.
	 * @param value the header value string
	 * @return the parsed ContentType
	 * @exception MalformedValueException if the value is invalid
	 */
	public static ContentType parse(String value) throws MalformedValueException {
		return parse(value, ScanOptions.CONTENT_TYPE);
	}

	/**
	 * Parses a Content-Type header value.
	 * @param value the header value string
	 * @param strict whether a parameter that cannot be understood fails
	 * the parse
	 * @return the parsed ContentType
	 * @exception MalformedValueException if the value is invalid
	 */
	public static ContentType parse(String value, boolean strict) throws MalformedValueException {
		return parse(value, ScanOptions.CONTENT_TYPE.withStrict(strict));
	}

	/**
	 * Parses a Content-Type header value with the given scan options.
	 * @param value the header value string
	 * @param options the options for scanning the parameters
	 * @return the parsed ContentType
	 * @exception MalformedValueException if the value is invalid
	 */
	public static ContentType parse(String value, ScanOptions options) throws MalformedValueException {
		return tryParse(value, options).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Parses a Content-Type header value without throwing.
	 * @param value the header value string
	 * @param options the options for scanning the parameters
	 * @return the content type with warnings for any skipped
	 * parameters, or a failure
	 */
	public static ParseResult<ContentType> tryParse(String value, ScanOptions options) {
		if (value == null || options == null) {
			throw new NullPointerException("value and options must not be null");
		}

		// Find the separator between type/subtype and parameters
		int semicolonIndex = ParameterParser.indexOfDelimiter(value, ';', 0, options);
		String typePart = semicolonIndex < 0 ? value : value.substring(0, semicolonIndex);
		String paramsPart = semicolonIndex < 0 ? "" : value.substring(semicolonIndex + 1);

		if (options.isCommentAware()) {
			typePart = Tokens.stripComments(typePart);
			if (typePart == null) {
				return malformed("err.unterminated_comment");
			}
		}
		typePart = typePart.trim();

		// Parse type and subtype
		int slashIndex = typePart.indexOf('/');
		if (slashIndex < 0) {
			return malformed("err.missing_slash");
		}
		String primaryType = typePart.substring(0, slashIndex).trim();
		String subType = typePart.substring(slashIndex + 1).trim();
		String suffix = null;
		int plusIndex = subType.lastIndexOf('+');
		if (plusIndex >= 0) {
			suffix = subType.substring(plusIndex + 1);
			subType = subType.substring(0, plusIndex);
			if (subType.isEmpty() || suffix.isEmpty()) {
				return malformed("err.empty_suffix", typePart);
			}
		}
		if (!Tokens.isToken(primaryType) || !Tokens.isToken(subType) ||
				(suffix != null && !Tokens.isToken(suffix))) {
			return malformed("err.invalid_type", typePart);
		}

		// Parse parameters
		ParseResult<List<Parameter>> scanned = ParameterParser.scan(HEADER_NAME, paramsPart, options);
		if (!scanned.isSuccess()) {
			return ParseResult.failure(scanned.getFailureKind(), scanned.getFailureMessage());
		}
		Map<String, String> parameters = new LinkedHashMap<>();
		for (Parameter parameter : scanned.getValue()) {
			parameters.remove(parameter.getName());
			parameters.put(parameter.getName(), parameter.getValue());
		}
		ContentType contentType = new ContentType(primaryType, subType, suffix, parameters);
		return ParseResult.success(contentType, scanned.getWarnings());
	}

	private static ParseResult<ContentType> malformed(String key, Object... args) {
		return ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE, SkippedElements.message(key, args));
	}

}
