/*
 * AcceptParser.java
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

import org.bluezoo.fieldparse.ContentType;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.ParseResult;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parser for the Accept header.
 * <p>
 * The media ranges are returned in preference order: highest quality
 * first, an explicit {@code q=1} ahead of an omitted quality, more
 * specific ranges ahead of less specific ones, and otherwise in the
 * order they were given. The quality is removed from the parameters
 * and attached to the content type when it was given explicitly.
 * Ranges with a quality of 0 are kept at the end of the list.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-12.5.1'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AcceptParser {

	private static final Logger LOGGER = Logger.getLogger(AcceptParser.class.getName());

	static final String HEADER_NAME = "Accept";

	private AcceptParser() {
		// Static utility class
	}

	/**
	 * Parses an Accept header, skipping media ranges that cannot be
	 * understood.
	 * @param value the header value
	 * @return the media ranges in preference order
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static List<ContentType> parse(String value) throws MalformedValueException {
		return parse(value, false);
	}

	/**
	 * Parses an Accept header.
	 * @param value the header value
	 * @param strict whether a media range that cannot be understood
	 * fails the parse
	 * @return the media ranges in preference order
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<ContentType> parse(String value, boolean strict) throws MalformedValueException {
		return parseWithWarnings(value, strict).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Parses an Accept header without throwing.
	 * @param value the header value
	 * @param strict whether a media range that cannot be understood
	 * fails the parse
	 * @return the media ranges with a warning for each range that was
	 * skipped, or a failure
	 */
	public static ParseResult<List<ContentType>> parseWithWarnings(String value, boolean strict) {
		ScanOptions options = ScanOptions.CONTENT_TYPE.withStrict(strict);
		ParseResult<List<String>> split = ListParser.split(value, options);
		if (!split.isSuccess()) {
			return ParseResult.failure(split.getFailureKind(), split.getFailureMessage());
		}
		List<String> warnings = new ArrayList<>();
		List<QualityValue<ContentType>> ranges = new ArrayList<>();
		int position = 0;
		for (String element : split.getValue()) {
			ParseResult<ContentType> parsed = ContentTypeParser.tryParse(element, options);
			if (!parsed.isSuccess()) {
				if (strict) {
					return SkippedElements.strictFailure(HEADER_NAME, element, parsed);
				}
				SkippedElements.record(LOGGER, HEADER_NAME, element, parsed.getFailureMessage(), warnings);
				continue;
			}
			warnings.addAll(parsed.getWarnings());
			ContentType contentType = parsed.getValue();
			double quality = 1.0;
			boolean explicit = false;
			String q = contentType.getParameter("q");
			if (q != null) {
				ParseResult<Double> parsedQuality = QualityValue.parseQuality(q, strict);
				if (!parsedQuality.isSuccess()) {
					if (strict) {
						return SkippedElements.strictFailure(HEADER_NAME, element, parsedQuality);
					}
					SkippedElements.record(LOGGER, HEADER_NAME, element, parsedQuality.getFailureMessage(), warnings);
					continue;
				}
				warnings.addAll(parsedQuality.getWarnings());
				quality = parsedQuality.getValue();
				explicit = quality == 1.0;
				contentType = contentType.withoutParameter("q").withQuality(quality);
			}
			ranges.add(new QualityValue<>(contentType, quality, explicit, contentType.getSpecificity(), position++));
		}
		return ParseResult.success(QualityValue.sort(ranges), warnings);
	}

}
