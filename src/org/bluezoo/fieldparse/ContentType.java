/*
 * ContentType.java
 * Copyright (C) 2005, 2013, 2025 Chris Burdess
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A MIME Content-Type value, optionally carrying the quality it was
 * given in an Accept header.
 * <p>
 * The primary type, subtype and structured-syntax suffix are folded to
 * lower case, as are parameter names. Parameter values are kept as
 * given. Instances are immutable: the {@code with} methods return new
 * instances.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc2045#section-5'>RFC 2045</a>
 * @see <a href='https://www.rfc-editor.org/rfc/rfc6839'>RFC 6839</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentType {

	/**
	 * The wildcard used for either the primary type or the subtype.
	 */
	public static final String WILDCARD = "*";

	private final String primaryType;
	private final String subType;
	private final String suffix;
	private final Map<String, String> parameters;
	private final Double quality;

	/**
	 * Constructor for a content type without parameters.
	 * @param primaryType the primary component of the media type, e.g.
	 * "text", "image", or "application". May not be null
	 * @param subType the subtype of the media type, e.g. "plain".
	 * May not be null
	 * @exception NullPointerException if primaryType or subType are null
	 * @exception IllegalArgumentException if primaryType or subType are
	 * empty
	 */
	public ContentType(String primaryType, String subType) {
		this(primaryType, subType, null, null, null);
	}

	/**
	 * Constructor.
	 * @param primaryType the primary component of the media type.
	 * May not be null
	 * @param subType the subtype of the media type. May not be null
	 * @param parameters optional parameters for the content type, in
	 * order. May be null
	 * @exception NullPointerException if primaryType or subType are null
	 * @exception IllegalArgumentException if primaryType or subType are
	 * empty
	 */
	public ContentType(String primaryType, String subType, Map<String, String> parameters) {
		this(primaryType, subType, null, parameters, null);
	}

	/**
	 * Constructor.
	 * @param primaryType the primary component of the media type.
	 * May not be null
	 * @param subType the subtype of the media type, without the suffix.
	 * May not be null
	 * @param suffix the structured-syntax suffix without the leading
	 * '+', e.g. "json". May be null
	 * @param parameters optional parameters for the content type, in
	 * order. May be null
	 * @exception NullPointerException if primaryType or subType are null
	 * @exception IllegalArgumentException if primaryType or subType are
	 * empty
	 */
	public ContentType(String primaryType, String subType, String suffix, Map<String, String> parameters) {
		this(primaryType, subType, suffix, parameters, null);
	}

	private ContentType(String primaryType, String subType, String suffix,
			Map<String, String> parameters, Double quality) {
		if (primaryType == null || subType == null) {
			throw new NullPointerException("primaryType and subType must not be null");
		}
		this.primaryType = primaryType.trim().toLowerCase(Locale.ROOT);
		this.subType = subType.trim().toLowerCase(Locale.ROOT);
		if (this.primaryType.isEmpty() || this.subType.isEmpty()) {
			throw new IllegalArgumentException("primaryType and subType must not be empty");
		}
		String s = (suffix == null) ? null : suffix.trim().toLowerCase(Locale.ROOT);
		this.suffix = (s == null || s.isEmpty()) ? null : s;
		if (parameters != null && !parameters.isEmpty()) {
			Map<String, String> map = new LinkedHashMap<>();
			for (Map.Entry<String, String> entry : parameters.entrySet()) {
				String name = entry.getKey().toLowerCase(Locale.ROOT);
				map.remove(name);
				map.put(name, Objects.requireNonNull(entry.getValue(), name));
			}
			this.parameters = Collections.unmodifiableMap(map);
		} else {
			this.parameters = Collections.emptyMap();
		}
		if (quality != null && (quality < 0.0 || quality > 1.0 || quality.isNaN())) {
			throw new IllegalArgumentException("quality must be between 0 and 1: " + quality);
		}
		this.quality = quality;
	}

	/**
	 * Returns the primary type for this content type, e.g. "text" or
	 * "image".
	 * @return the primary type (the part of the media type before the '/')
	 */
	public String getPrimaryType() {
		return primaryType;
	}

	/**
	 * Indicates whether this content type matches the specified primary
	 * type. Comparisons are case insensitive.
	 * @param primaryType the primary media type to test
	 * @return true if this content-type matches, false otherwise
	 */
	public boolean isPrimaryType(String primaryType) {
		return this.primaryType.equalsIgnoreCase(primaryType);
	}

	/**
	 * Returns the subtype for this content type, e.g. "plain" or "jpeg".
	 * The structured-syntax suffix is not included.
	 * @return the subtype
	 */
	public String getSubType() {
		return subType;
	}

	/**
	 * Indicates whether this content type matches the specified subtype.
	 * Comparisons are case insensitive.
	 * @param subType the media subtype to test
	 * @return true if this content-type matches, false otherwise
	 */
	public boolean isSubType(String subType) {
		return this.subType.equalsIgnoreCase(subType);
	}

	/**
	 * Returns the structured-syntax suffix, e.g. "json" for
	 * {@code application/problem+json}.
	 * @return the suffix, or null if there is none
	 */
	public String getSuffix() {
		return suffix;
	}

	/**
	 * Indicates whether this content type matches the specified primary
	 * type and subtype. Comparisons are case insensitive.
	 * @param primaryType the primary type to test
	 * @param subType the subtype to test, optionally including a suffix
	 * @return true if this content-type matches both primary and subtype,
	 * false otherwise
	 */
	public boolean isMimeType(String primaryType, String subType) {
		return this.primaryType.equalsIgnoreCase(primaryType) &&
			   getFullSubType().equalsIgnoreCase(subType);
	}

	/**
	 * Indicates whether this content type matches the specified MIME type string.
	 * The string should be in "type/subtype" format.
	 * Comparisons are case insensitive.
	 * @param mimeType the MIME type to test (e.g., "text/html")
	 * @return true if this content-type matches the given MIME type, false otherwise
	 */
	public boolean isMimeType(String mimeType) {
		if (mimeType == null) {
			return false;
		}
		int slashIndex = mimeType.indexOf('/');
		if (slashIndex < 0) {
			return false;
		}
		String type = mimeType.substring(0, slashIndex);
		String subtype = mimeType.substring(slashIndex + 1);
		return isMimeType(type, subtype);
	}

	/**
	 * Indicates whether the primary type is the wildcard.
	 * @return true for {@code *}{@code /*}
	 */
	public boolean isWildcardType() {
		return WILDCARD.equals(primaryType);
	}

	/**
	 * Indicates whether the subtype is the wildcard.
	 * @return true for {@code type/*} and {@code *}{@code /*}
	 */
	public boolean isWildcardSubType() {
		return WILDCARD.equals(subType);
	}

	/**
	 * Returns the parameters for this content type. This never includes
	 * the quality, which is available from {@link #getQuality()}.
	 * @return the unmodifiable parameter map, keyed by lower-case name,
	 * in the order the parameters were given
	 */
	public Map<String, String> getParameters() {
		return parameters;
	}

	/**
	 * Returns the value for the specified parameter name, if any.
	 * Parameter names are case insensitive.
	 * @param name the name of the parameter
	 * @return the value, or null if there is no such parameter
	 */
	public String getParameter(String name) {
		return parameters.get(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * Indicates whether this content type contains the specified parameter.
	 * @param name the name of the parameter
	 * @return true if a parameter with this name is present, false otherwise
	 */
	public boolean hasParameter(String name) {
		return parameters.containsKey(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * Indicates whether a quality was attached to this content type.
	 * @return true if a quality was given explicitly or by a parser
	 */
	public boolean hasQuality() {
		return quality != null;
	}

	/**
	 * Returns the quality of this content type.
	 * @return the quality, 1.0 if none was attached
	 */
	public double getQuality() {
		return (quality == null) ? 1.0 : quality;
	}

	/**
	 * Returns how specific this content type is as a pattern:
	 * 0 for {@code *}{@code /*}, 1 for {@code type/*}, and 2 plus the
	 * number of parameters for a concrete type.
	 * @return the specificity rank, higher is more specific
	 */
	public int getSpecificity() {
		if (isWildcardType()) {
			return 0;
		}
		if (isWildcardSubType()) {
			return 1;
		}
		return 2 + parameters.size();
	}

	/**
	 * Returns a copy of this content type with a parameter added or
	 * replaced.
	 * @param name the parameter name
	 * @param value the parameter value
	 * @return the new content type
	 */
	public ContentType withParameter(String name, String value) {
		Map<String, String> map = new LinkedHashMap<>(parameters);
		String key = name.toLowerCase(Locale.ROOT);
		map.remove(key);
		map.put(key, value);
		return new ContentType(primaryType, subType, suffix, map, quality);
	}

	/**
	 * Returns a copy of this content type without the named parameter.
	 * @param name the parameter name
	 * @return the new content type, or this one if the parameter was
	 * not present
	 */
	public ContentType withoutParameter(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		if (!parameters.containsKey(key)) {
			return this;
		}
		Map<String, String> map = new LinkedHashMap<>(parameters);
		map.remove(key);
		return new ContentType(primaryType, subType, suffix, map, quality);
	}

	/**
	 * Returns a copy of this content type with the given quality.
	 * @param quality the quality, between 0.0 and 1.0 inclusive
	 * @return the new content type
	 * @exception IllegalArgumentException if quality is out of range
	 */
	public ContentType withQuality(double quality) {
		return new ContentType(primaryType, subType, suffix, parameters, quality);
	}

	/**
	 * Returns a copy of this content type with no quality attached.
	 * @return the new content type
	 */
	public ContentType withoutQuality() {
		if (quality == null) {
			return this;
		}
		return new ContentType(primaryType, subType, suffix, parameters, null);
	}

	private String getFullSubType() {
		return (suffix == null) ? subType : subType + "+" + suffix;
	}

	/**
	 * Content types are equal if their types, suffixes and parameters
	 * are equal. Parameter order and quality are not significant.
	 */
	@Override
	public boolean equals(Object other) {
		if (!(other instanceof ContentType)) {
			return false;
		}
		ContentType o = (ContentType) other;
		return primaryType.equals(o.primaryType) &&
			   subType.equals(o.subType) &&
			   Objects.equals(suffix, o.suffix) &&
			   parameters.equals(o.parameters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(primaryType, subType, suffix, parameters);
	}

	/**
	 * Returns the canonical form of this content type:
	 * {@code type/subtype+suffix} followed by the parameters sorted by
	 * name, with values quoted where required. The quality is omitted.
	 */
	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder(primaryType);
		buf.append('/');
		buf.append(getFullSubType());
		if (!parameters.isEmpty()) {
			List<String> names = new ArrayList<>(parameters.keySet());
			Collections.sort(names);
			for (String name : names) {
				buf.append("; ");
				buf.append(name);
				buf.append('=');
				buf.append(Tokens.quoteIfNeeded(parameters.get(name)));
			}
		}
		return buf.toString();
	}

	/**
	 * Serializes this content type in header format. This is the
	 * canonical form followed by a {@code q} parameter if a quality is
	 * attached, which makes the result suitable for an Accept header.
	 * @return the serialized value
	 */
	public String toHeaderValue() {
		if (quality == null) {
			return toString();
		}
		return toString() + "; q=" + formatQuality(quality);
	}

	static String formatQuality(double quality) {
		BigDecimal q = BigDecimal.valueOf(quality).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros();
		return q.signum() == 0 ? "0" : q.toPlainString();
	}

}
