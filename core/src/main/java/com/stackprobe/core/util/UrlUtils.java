package com.stackprobe.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 입력 보정 + origin 계산 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 스킴이 없으면 https:// 접두. 앞뒤 공백 제거 */
    public static String ensureScheme(String raw) {
        if (raw == null) throw new IllegalArgumentException("url is null");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("url is blank");
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return s;
        return "https://" + s;
    }

    /** ensureScheme 후 URI 변환. 잘못된 형식이면 IllegalArgumentException */
    public static URI toUri(String raw) {
        String s = ensureScheme(raw);
        try {
            URI u = new URI(s);
            if (u.getHost() == null || u.getHost().isBlank())
                throw new IllegalArgumentException("url has no host: " + raw);
            return u;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid url: " + raw, e);
        }
    }

    /**
     * scheme://host[:port] (path/query/fragment 제거, host 소문자, 기본 포트 제거)
     */
    public static URI origin(URI u) {
        if (u == null) return null;
        String scheme = (u.getScheme() == null ? "https" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }
        try {
            return new URI(scheme, null, host, port, null, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("cannot derive origin: " + u, e);
        }
    }

    /** origin 기준 절대 경로 해석(예: "/robots.txt") */
    public static URI resolveOnOrigin(URI page, String absolutePath) {
        URI o = origin(page);
        String p = absolutePath.startsWith("/") ? absolutePath : "/" + absolutePath;
        return URI.create(o.toString() + p);
    }
}
