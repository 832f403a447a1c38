/*
 * UrlRewriter.java
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

package org.bluezoo.fieldparse.url;

import java.io.ByteArrayOutputStream;
import java.net.IDN;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites components of a URL.
 * <p>
 * Start with {@link #of(String)}, replace components with the
 * {@code with} methods and call {@link #build()}. Components that are
 * not replaced are copied from the original URL. Replacing a component
 * with null removes it; a null path becomes "/". Replacement values are
 * percent-encoded as UTF-8 according to the rules for their component.
 * <p>
 * A replacement host is IDNA-encoded when the scheme is one of
 * {@link #IDNA_SCHEMES}, unless told otherwise with
 * {@link #encodeWithIdna(Boolean)}; other hosts are percent-encoded.
 * <p>
 * A query may be given as a string, which is used as-is, as a map,
 * which is form-encoded sorted by name, or as a list of pairs, which is
 * form-encoded in order.
 * <p>
 * Instances are not thread safe.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc3986'>RFC 3986</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UrlRewriter {

	static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.fieldparse.url.L10N");

	/**
	 * The schemes whose hosts are IDNA-encoded by default.
	 */
	public static final Set<String> IDNA_SCHEMES =
		Collections.unmodifiableSet(new HashSet<>(Arrays.asList("http", "https", "ftp", "afp", "sftp", "smb")));

	/** RFC 3986 appendix B. */
	private static final Pattern URL = Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?");

	private static final String SUB_DELIMS = "!$&'()*+,;=";
	static final String USERINFO_SAFE = SUB_DELIMS + "~:";
	static final String HOST_SAFE = SUB_DELIMS + "~";
	static final String PATH_SAFE = SUB_DELIMS + "~:/@";
	static final String FRAGMENT_SAFE = "?/";

	/** Schemes that are written with "//" even when the authority is empty. */
	private static final Set<String> USES_NETLOC = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
		"ftp", "http", "gopher", "nntp", "telnet", "imap", "wais", "file", "mms", "https", "shttp",
		"snews", "prospero", "rtsp", "rtspu", "rsync", "svn", "svn+ssh", "sftp", "nfs", "git",
		"git+ssh", "ws", "wss")));

	private static final int MAX_HOST_LENGTH = 255;
	private static final int MAX_LABEL_LENGTH = 63;

	private String scheme;
	private String user;
	private String password;
	private String host;
	private String port;
	private String path;
	private String query;
	private String fragment;

	private boolean hostReplaced;
	private boolean enableLongHost;
	private Boolean encodeWithIdna;

	private UrlRewriter(String url) {
		Matcher m = URL.matcher(url);
		m.matches(); // every string matches
		scheme = m.group(2);
		String authority = m.group(4);
		if (authority != null) {
			int at = authority.lastIndexOf('@');
			if (at >= 0) {
				String userinfo = authority.substring(0, at);
				int colon = userinfo.indexOf(':');
				if (colon < 0) {
					user = percentDecode(userinfo);
				} else {
					user = percentDecode(userinfo.substring(0, colon));
					password = percentDecode(userinfo.substring(colon + 1));
				}
				authority = authority.substring(at + 1);
			}
			int portIndex = authority.lastIndexOf(':');
			if (portIndex >= 0 && portIndex > authority.lastIndexOf(']')) {
				port = authority.substring(portIndex + 1);
				authority = authority.substring(0, portIndex);
			}
			host = authority.toLowerCase(Locale.ROOT);
		}
		path = m.group(5);
		query = m.group(7);
		fragment = m.group(9);
	}

	/**
	 * Starts rewriting a URL.
	 * @param url the URL to rewrite
	 * @return a rewriter initialized with the components of the URL
	 */
	public static UrlRewriter of(String url) {
		if (url == null) {
			throw new NullPointerException("url must not be null");
		}
		return new UrlRewriter(url);
	}

	/**
	 * Removes the user name and password from a URL.
	 * @param url the URL to sanitize
	 * @return the removed user information and the sanitized URL
	 */
	public static UrlAuth removeAuth(String url) {
		UrlRewriter rewriter = of(url);
		String username = (rewriter.user == null || rewriter.user.isEmpty()) ? null : rewriter.user;
		String password = rewriter.password;
		String sanitized = rewriter.withUser(null).build();
		return new UrlAuth(username, password, sanitized);
	}

	/**
	 * Replaces the scheme. A null scheme makes the URL relative.
	 * @param scheme the new scheme
	 * @return this rewriter
	 */
	public UrlRewriter withScheme(String scheme) {
		this.scheme = scheme;
		return this;
	}

	/**
	 * Replaces the user name. A null user name also removes the
	 * password.
	 * @param user the new user name, not encoded
	 * @return this rewriter
	 */
	public UrlRewriter withUser(String user) {
		this.user = user;
		return this;
	}

	/**
	 * Replaces the password.
	 * @param password the new password, not encoded
	 * @return this rewriter
	 */
	public UrlRewriter withPassword(String password) {
		this.password = password;
		return this;
	}

	/**
	 * Replaces the host. A null host removes the whole authority apart
	 * from the user information.
	 * @param host the new host, not encoded
	 * @return this rewriter
	 */
	public UrlRewriter withHost(String host) {
		this.host = host;
		this.hostReplaced = true;
		return this;
	}

	/**
	 * Replaces the port. The port is written only if there is a host.
	 * @param port the new port, or null to remove it
	 * @return this rewriter
	 * @exception IllegalArgumentException if port is negative
	 */
	public UrlRewriter withPort(Integer port) {
		if (port != null && port < 0) {
			throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.negative_port"), port));
		}
		this.port = (port == null) ? null : port.toString();
		return this;
	}

	/**
	 * Replaces the path.
	 * @param path the new path, not encoded. Null means "/"
	 * @return this rewriter
	 */
	public UrlRewriter withPath(String path) {
		this.path = (path == null) ? "/" : percentEncode(path, PATH_SAFE, false);
		return this;
	}

	/**
	 * Replaces the query with a string that is used without encoding.
	 * @param query the new query, or null to remove it
	 * @return this rewriter
	 */
	public UrlRewriter withQuery(String query) {
		this.query = query;
		return this;
	}

	/**
	 * Replaces the query with form-encoded parameters sorted by name.
	 * @param parameters the query parameters; values are converted with
	 * {@code toString}
	 * @return this rewriter
	 */
	public UrlRewriter withQuery(Map<String, ?> parameters) {
		if (parameters == null) {
			this.query = null;
			return this;
		}
		return withQuery(new ArrayList<Map.Entry<String, ?>>(new TreeMap<String, Object>(parameters).entrySet()));
	}

	/**
	 * Replaces the query with form-encoded parameters in the given order.
	 * @param parameters the query parameters; values are converted with
	 * {@code toString}
	 * @return this rewriter
	 */
	public UrlRewriter withQuery(List<? extends Map.Entry<String, ?>> parameters) {
		if (parameters == null) {
			this.query = null;
			return this;
		}
		StringBuilder buf = new StringBuilder();
		for (Map.Entry<String, ?> parameter : parameters) {
			if (buf.length() > 0) {
				buf.append('&');
			}
			buf.append(percentEncode(parameter.getKey(), "", true));
			buf.append('=');
			buf.append(percentEncode(String.valueOf(parameter.getValue()), "", true));
		}
		this.query = buf.toString();
		return this;
	}

	/**
	 * Replaces the fragment.
	 * @param fragment the new fragment, not encoded, or null to remove it
	 * @return this rewriter
	 */
	public UrlRewriter withFragment(String fragment) {
		this.fragment = (fragment == null) ? null : percentEncode(fragment, FRAGMENT_SAFE, false);
		return this;
	}

	/**
	 * Allows a replacement host longer than 255 characters. Labels are
	 * still limited to 63 characters.
	 * @return this rewriter
	 */
	public UrlRewriter enableLongHost() {
		this.enableLongHost = true;
		return this;
	}

	/**
	 * Controls how a replacement host is encoded.
	 * @param encodeWithIdna true to IDNA-encode, false to
	 * percent-encode, or null to decide by scheme
	 * @return this rewriter
	 */
	public UrlRewriter encodeWithIdna(Boolean encodeWithIdna) {
		this.encodeWithIdna = encodeWithIdna;
		return this;
	}

	/**
	 * Assembles the rewritten URL.
	 * @return the URL
	 * @exception IllegalArgumentException if the replacement host cannot
	 * be encoded or is too long
	 */
	public String build() {
		String h = host;
		if (hostReplaced && h != null) {
			h = normalizeHost(h);
		}
		StringBuilder netloc = new StringBuilder();
		if (user != null) {
			netloc.append(percentEncode(user, USERINFO_SAFE, false));
			if (password != null && !password.isEmpty()) {
				netloc.append(':').append(percentEncode(password, USERINFO_SAFE, false));
			}
			netloc.append('@');
		}
		if (h != null && !h.isEmpty()) {
			netloc.append(h);
			if (port != null && !port.isEmpty()) {
				netloc.append(':').append(port);
			}
		}
		StringBuilder url = new StringBuilder();
		boolean hasScheme = scheme != null && !scheme.isEmpty();
		if (hasScheme) {
			url.append(scheme).append(':');
		}
		String p = (path == null) ? "" : path;
		if (netloc.length() > 0 || (hasScheme && USES_NETLOC.contains(scheme.toLowerCase(Locale.ROOT)))) {
			url.append("//").append(netloc);
			if (!p.isEmpty() && p.charAt(0) != '/') {
				url.append('/');
			}
		}
		url.append(p);
		if (query != null && !query.isEmpty()) {
			url.append('?').append(query);
		}
		if (fragment != null && !fragment.isEmpty()) {
			url.append('#').append(fragment);
		}
		return url.toString();
	}

	private String normalizeHost(String h) {
		if (h.startsWith("[")) {
			return h; // IP literal
		}
		boolean idna;
		if (encodeWithIdna != null) {
			idna = encodeWithIdna;
		} else {
			idna = scheme != null && IDNA_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT));
		}
		String encoded;
		if (idna) {
			StringBuilder buf = new StringBuilder();
			for (String label : h.split("\\.", -1)) {
				if (buf.length() > 0) {
					buf.append('.');
				}
				try {
					buf.append(IDN.toASCII(label, IDN.ALLOW_UNASSIGNED));
				} catch (IllegalArgumentException e) {
					String message = MessageFormat.format(L10N.getString("err.invalid_host"), h);
					throw new IllegalArgumentException(message, e);
				}
			}
			encoded = buf.toString();
		} else {
			encoded = percentEncode(h, HOST_SAFE, false);
		}
		for (String label : encoded.split("\\.")) {
			if (label.length() > MAX_LABEL_LENGTH) {
				throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.label_too_long"), label));
			}
		}
		if (encoded.length() > MAX_HOST_LENGTH && !enableLongHost) {
			throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.host_too_long"), encoded));
		}
		return encoded;
	}

	/**
	 * Percent-encodes the UTF-8 bytes of a string. Letters, digits,
	 * "_.-~" and the given safe characters are kept.
	 * @param s the string to encode
	 * @param safe additional characters not to encode
	 * @param form whether to write spaces as '+', as in form encoding
	 * @return the encoded string
	 */
	static String percentEncode(String s, String safe, boolean form) {
		StringBuilder buf = new StringBuilder(s.length());
		for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
			int c = b & 0xff;
			if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') ||
					c == '_' || c == '.' || c == '-' || c == '~' ||
					(c < 0x80 && safe.indexOf(c) >= 0)) {
				buf.append((char) c);
			} else if (c == ' ' && form) {
				buf.append('+');
			} else {
				buf.append('%');
				buf.append(Character.toUpperCase(Character.forDigit(c >> 4, 16)));
				buf.append(Character.toUpperCase(Character.forDigit(c & 0xf, 16)));
			}
		}
		return buf.toString();
	}

	/**
	 * Decodes percent-encoded UTF-8. Malformed escapes are kept as-is.
	 * @param s the string to decode
	 * @return the decoded string
	 */
	static String percentDecode(String s) {
		if (s.indexOf('%') < 0) {
			return s;
		}
		ByteArrayOutputStream out = new ByteArrayOutputStream(s.length());
		int len = s.length();
		for (int i = 0; i < len; i++) {
			char c = s.charAt(i);
			if (c == '%' && i + 2 < len) {
				int hi = Character.digit(s.charAt(i + 1), 16);
				int lo = Character.digit(s.charAt(i + 2), 16);
				if (hi >= 0 && lo >= 0) {
					out.write((hi << 4) | lo);
					i += 2;
					continue;
				}
			}
			int next = s.indexOf('%', i + 1);
			if (next < 0) {
				next = len;
			}
			byte[] bytes = s.substring(i, next).getBytes(StandardCharsets.UTF_8);
			out.write(bytes, 0, bytes.length);
			i = next - 1;
		}
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

}
