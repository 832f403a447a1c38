/*
 * ForwardedParser.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parser for the Forwarded header.
 * <p>
 * Each comma-separated element, one per proxy hop, becomes a map from
 * parameter name (in lower case) to value. The elements are returned
 * in the order received. When a parameter is repeated within an
 * element the last occurrence wins.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc7239#section-4'>RFC 7239</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ForwardedParser {

	private static final Logger LOGGER = Logger.getLogger(ForwardedParser.class.getName());

	static final String HEADER_NAME = "Forwarded";

	/**
	 * The parameters registered by RFC 7239.
	 */
	public static final Set<String> STANDARD_PARAMETERS =
		Collections.unmodifiableSet(new HashSet<>(Arrays.asList("by", "for", "host", "proto")));

	private ForwardedParser() {
		// Static utility class
	}

	/**
	 * Parses a Forwarded header, skipping elements that cannot be
	 * understood.
	 * @param value the header value
	 * @return one map per forwarding hop
	 * @exception MalformedValueException if the list itself is malformed
	 */
	public static List<Map<String, String>> parse(String value) throws MalformedValueException {
		return parse(value, false, false);
	}

	/**
	 * Parses a Forwarded header.
	 * @param value the header value
	 * @param onlyStandardParameters whether to restrict parameters to
	 * those registered by RFC 7239. Other parameters are dropped, or in
	 * strict mode fail the parse
	 * @param strict whether anything that cannot be understood fails the
	 * parse
	 * @return one map per forwarding hop
	 * @exception MalformedValueException if the value is malformed
	 */
	public static List<Map<String, String>> parse(String value, boolean onlyStandardParameters, boolean strict)
			throws MalformedValueException {
		return parseWithWarnings(value, onlyStandardParameters, strict).getValueOrThrow(HEADER_NAME, value);
	}

	/**
	 * Parses a Forwarded header without throwing.
	 * @param value the header value
	 * @param onlyStandardParameters whether to restrict parameters to
	 * those registered by RFC 7239
	 * @param strict whether anything that cannot be understood fails the
	 * parse
	 * @return the elements with a warning for everything that was
	 * skipped, or a failure
	 */
	public static ParseResult<List<Map<String, String>>> parseWithWarnings(String value,
			boolean onlyStandardParameters, boolean strict) {
		ScanOptions options = ScanOptions.FORWARDED.withStrict(strict);
		ParseResult<List<String>> split = ListParser.split(value, options);
		if (!split.isSuccess()) {
			return ParseResult.failure(split.getFailureKind(), split.getFailureMessage());
		}
		List<String> warnings = new ArrayList<>();
		List<Map<String, String>> elements = new ArrayList<>();
		for (String element : split.getValue()) {
			ParseResult<List<Parameter>> scanned = ParameterParser.scan(HEADER_NAME, element, options);
			if (!scanned.isSuccess()) {
				if (strict) {
					return SkippedElements.strictFailure(HEADER_NAME, element, scanned);
				}
				SkippedElements.record(LOGGER, HEADER_NAME, element, scanned.getFailureMessage(), warnings);
				continue;
			}
			warnings.addAll(scanned.getWarnings());
			Map<String, String> pairs = new LinkedHashMap<>();
			for (Parameter parameter : scanned.getValue()) {
				String name = parameter.getName();
				if (onlyStandardParameters && !STANDARD_PARAMETERS.contains(name)) {
					String reason = SkippedElements.message("warn.nonstandard_parameter", name);
					String pair = parameter.toHeaderValue();
					if (strict) {
						return ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION,
								SkippedElements.message("warn.skipped", HEADER_NAME, pair, reason));
					}
					SkippedElements.record(LOGGER, HEADER_NAME, pair, reason, warnings);
					continue;
				}
				pairs.remove(name);
				pairs.put(name, parameter.getValue());
			}
			if (!pairs.isEmpty()) {
				elements.add(Collections.unmodifiableMap(pairs));
			}
		}
		return ParseResult.success(Collections.unmodifiableList(elements), warnings);
	}

}
