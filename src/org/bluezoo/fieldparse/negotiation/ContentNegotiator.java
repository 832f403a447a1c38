/*
 * ContentNegotiator.java
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

package org.bluezoo.fieldparse.negotiation;

import org.bluezoo.fieldparse.ContentType;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.NoMatchException;
import org.bluezoo.fieldparse.parser.AcceptParser;

import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Proactive content negotiation.
 * <p>
 * The requested media ranges are taken in the order given, which for a
 * parsed Accept header is preference order. For each range the
 * available content types are scanned in server preference order and
 * the first that matches is selected. Ranges with a quality of 0 are
 * never selected. They also refuse any available type they name at
 * least as specifically as the range being tried, so a client that
 * refuses {@code text/html} does not receive it through a wildcard.
 * <p>
 * A range matches an available type when the types, subtypes and
 * suffixes agree, allowing wildcards on either side, and when every
 * parameter of the available type is present with the same value on
 * the range. Parameters only on the requested side do not prevent a
 * match. Wildcard ranges such as {@code text/*} match regardless of
 * parameters.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc9110#section-12.1'>RFC 9110</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentNegotiator {

	private static final Logger LOGGER = Logger.getLogger(ContentNegotiator.class.getName());
	static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.fieldparse.negotiation.L10N");

	private static final List<ContentType> ANYTHING =
		Collections.singletonList(new ContentType(ContentType.WILDCARD, ContentType.WILDCARD));

	private ContentNegotiator() {
		// Static utility class
	}

	/**
	 * Selects the content type to produce.
	 * @param requested the requested media ranges in preference order.
	 * An empty or null list means anything is acceptable
	 * @param available the content types that can be produced, in
	 * preference order
	 * @return the selected content type and the range it matched
	 * @exception NoMatchException if nothing available is acceptable
	 */
	public static NegotiationResult selectContentType(List<ContentType> requested, List<ContentType> available)
			throws NoMatchException {
		return selectContentType(requested, available, null);
	}

	/**
	 * Selects the content type to produce, falling back to a default.
	 * @param requested the requested media ranges in preference order.
	 * An empty or null list means anything is acceptable
	 * @param available the content types that can be produced, in
	 * preference order
	 * @param defaultType the content type to use when nothing available
	 * is acceptable. May be null
	 * @return the selected content type and the range it matched, or
	 * the default paired with itself
	 * @exception NoMatchException if nothing available is acceptable
	 * and there is no default
	 */
	public static NegotiationResult selectContentType(List<ContentType> requested, List<ContentType> available,
			ContentType defaultType) throws NoMatchException {
		Objects.requireNonNull(available, "available");
		if (requested == null || requested.isEmpty()) {
			requested = ANYTHING;
		}
		for (ContentType range : requested) {
			if (range.getQuality() == 0.0) {
				continue;
			}
			for (ContentType candidate : available) {
				if (matches(range, candidate)) {
					ContentType rejection = findRejection(requested, range, candidate);
					if (rejection != null) {
						if (LOGGER.isLoggable(Level.FINE)) {
							String message = L10N.getString("log.rejected");
							LOGGER.fine(MessageFormat.format(message, candidate, rejection.toHeaderValue()));
						}
						continue;
					}
					if (LOGGER.isLoggable(Level.FINE)) {
						String message = L10N.getString("log.selected");
						LOGGER.fine(MessageFormat.format(message, candidate, range.toHeaderValue()));
					}
					return new NegotiationResult(range, candidate);
				}
			}
		}
		String ranges = format(requested);
		if (defaultType != null) {
			if (LOGGER.isLoggable(Level.FINE)) {
				String message = L10N.getString("log.default");
				LOGGER.fine(MessageFormat.format(message, ranges, defaultType));
			}
			return new NegotiationResult(defaultType, defaultType);
		}
		throw new NoMatchException(MessageFormat.format(L10N.getString("err.no_match"), ranges));
	}

	/**
	 * Selects the content type to produce for an Accept header.
	 * @param accept the Accept header value. Null or blank means anything
	 * is acceptable
	 * @param available the content types that can be produced, in
	 * preference order
	 * @return the selected content type and the range it matched
	 * @exception MalformedValueException if the Accept header is malformed
	 * @exception NoMatchException if nothing available is acceptable
	 */
	public static NegotiationResult selectContentType(String accept, List<ContentType> available)
			throws MalformedValueException, NoMatchException {
		return selectContentType(accept, available, null);
	}

	/**
	 * Selects the content type to produce for an Accept header, falling
	 * back to a default.
	 * @param accept the Accept header value. Null or blank means anything
	 * is acceptable
	 * @param available the content types that can be produced, in
	 * preference order
	 * @param defaultType the content type to use when nothing available
	 * is acceptable. May be null
	 * @return the selected content type and the range it matched, or
	 * the default paired with itself
	 * @exception MalformedValueException if the Accept header is malformed
	 * @exception NoMatchException if nothing available is acceptable
	 * and there is no default
	 */
	public static NegotiationResult selectContentType(String accept, List<ContentType> available,
			ContentType defaultType) throws MalformedValueException, NoMatchException {
		List<ContentType> requested = null;
		if (accept != null && !accept.trim().isEmpty()) {
			requested = AcceptParser.parse(accept);
		}
		return selectContentType(requested, available, defaultType);
	}

	/**
	 * Indicates whether an available content type satisfies a requested
	 * media range. Quality is not considered.
	 * @param range the requested media range
	 * @param candidate the available content type
	 * @return true if the candidate is acceptable to the range
	 */
	public static boolean matches(ContentType range, ContentType candidate) {
		if (!typeMatches(range, candidate)) {
			return false;
		}
		if (range.isWildcardSubType()) {
			return true;
		}
		Map<String, String> requestedParameters = range.getParameters();
		for (Map.Entry<String, String> entry : candidate.getParameters().entrySet()) {
			if (!entry.getValue().equals(requestedParameters.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Finds a range with a quality of 0 that refuses the candidate and is
	 * at least as specific as the range that accepted it. A refusing
	 * range names the candidate's type and every one of its parameters
	 * is present with the same value on the candidate.
	 */
	private static ContentType findRejection(List<ContentType> requested, ContentType range,
			ContentType candidate) {
		for (ContentType rejection : requested) {
			if (rejection.getQuality() != 0.0 ||
					rejection.getSpecificity() < range.getSpecificity() ||
					!typeMatches(rejection, candidate)) {
				continue;
			}
			boolean refused = true;
			for (Map.Entry<String, String> entry : rejection.getParameters().entrySet()) {
				if (!entry.getValue().equals(candidate.getParameter(entry.getKey()))) {
					refused = false;
					break;
				}
			}
			if (refused) {
				return rejection;
			}
		}
		return null;
	}

	private static boolean typeMatches(ContentType range, ContentType candidate) {
		if (!range.isWildcardType() && !candidate.isWildcardType() &&
				!range.getPrimaryType().equals(candidate.getPrimaryType())) {
			return false;
		}
		if (range.isWildcardSubType() || candidate.isWildcardSubType()) {
			// a wildcard with a suffix, e.g. application/*+json, constrains the suffix
			if (range.isWildcardSubType() && range.getSuffix() != null &&
					!range.getSuffix().equals(candidate.getSuffix())) {
				return false;
			}
			if (candidate.isWildcardSubType() && candidate.getSuffix() != null &&
					!candidate.getSuffix().equals(range.getSuffix())) {
				return false;
			}
		} else if (!range.getSubType().equals(candidate.getSubType()) ||
				!Objects.equals(range.getSuffix(), candidate.getSuffix())) {
			return false;
		}
		return true;
	}

	private static String format(List<ContentType> ranges) {
		StringBuilder buf = new StringBuilder();
		for (ContentType range : ranges) {
			if (buf.length() > 0) {
				buf.append(", ");
			}
			buf.append(range.toHeaderValue());
		}
		return buf.toString();
	}

}
