package com.stackprobe.core.scanner;

import com.stackprobe.core.model.PageMeta;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** JSoup 기반 페이지 메타 추출기: title / description / viewport + 상태 라인의 HTTP 버전 + https 여부 */
public final class PageMetaExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(PageMetaExtractor.class);

    private static final Pattern HTTP_VERSION = Pattern.compile("HTTP/[0-9][0-9.]*");

    public PageMeta extract(String body, String headers, URI url) {
        boolean ssl = isHttps(url);
        String httpVersion = httpVersion(headers);

        if (body == null || body.isBlank()) {
            return new PageMeta("", "", false, httpVersion, ssl);
        }

        String title = "";
        String description = "";
        boolean responsive = false;
        try {
            Document doc = Jsoup.parse(body);

            Element t = doc.selectFirst("title");
            if (t != null) title = t.text().trim();

            Element d = doc.selectFirst("meta[name=description]");
            if (d != null) description = d.attr("content").trim();

            for (Element v : doc.select("meta[name=viewport]")) {
                if (v.attr("content").toLowerCase(Locale.ROOT).replace(" ", "").contains("width=device-width")) {
                    responsive = true;
                    break;
                }
            }
        } catch (RuntimeException e) {
            // 파싱 불가 마크업 → 빈 값으로 진행
            LOG.debug("meta extraction failed for {}: {}", url, e.toString());
        }
        return new PageMeta(title, description, responsive, httpVersion, ssl);
    }

    /** 첫 번째 상태 라인의 "HTTP/x[.y]" 토큰. 없으면 빈 문자열 */
    public static String httpVersion(String headers) {
        if (headers == null || headers.isEmpty()) return "";
        int nl = headers.indexOf('\n');
        String first = (nl < 0 ? headers : headers.substring(0, nl)).trim();
        Matcher m = HTTP_VERSION.matcher(first.toUpperCase(Locale.ROOT));
        if (!m.find()) return "";
        String v = m.group();
        return v.endsWith(".") ? v.substring(0, v.length() - 1) : v;
    }

    private static boolean isHttps(URI url) {
        return url != null && "https".equalsIgnoreCase(url.getScheme());
    }
}
