package com.stackprobe.core.scanner;

import com.stackprobe.core.model.Category;
import com.stackprobe.core.model.TechProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TechDetectorTest {

    private final TechDetector detector = new TechDetector();

    @Test
    void emptyInputYieldsEmptySetForEveryCategory() {
        TechProfile p = detector.detect("", "");

        assertThat(p.asMap()).hasSize(Category.values().length);
        for (Category c : Category.values()) {
            assertThat(p.get(c)).as(c.key()).isEmpty();
        }
        assertThat(p.isEmpty()).isTrue();
    }

    @Test
    void nullInputIsTreatedAsEmpty() {
        assertThat(detector.detect(null, null)).isEqualTo(TechProfile.empty());
    }

    @Test
    void nginxWithWordPressBody() {
        String headers = "HTTP/1.1 200 OK\nServer: nginx\n";
        String body = "<html><head><link rel=\"stylesheet\" href=\"/wp-content/themes/x/style.css\"></head></html>";

        TechProfile p = detector.detect(headers, body);

        assertThat(p.get(Category.CMS)).containsExactly("WordPress");
        assertThat(p.get(Category.REVERSE_PROXIES)).contains("Nginx");
    }

    @Test
    void matchingIsCaseInsensitive() {
        TechProfile p = detector.detect("", "<script src=\"/static/JQUERY.min.js\"></script>");
        assertThat(p.get(Category.JAVASCRIPT_LIBRARIES)).contains("jQuery");
    }

    @Test
    void headerOnlyRuleDoesNotFireOnBodyText() {
        // Nginx 규칙은 헤더 대상
        TechProfile p = detector.detect("HTTP/1.1 200 OK\n", "<p>server: nginx</p>");
        assertThat(p.get(Category.REVERSE_PROXIES)).doesNotContain("Nginx");
    }

    @Test
    void cloudflareIsReportedInSeveralCategories() {
        String headers = "HTTP/2 200\nserver: cloudflare\ncf-ray: 8a1b2c3d4e5f-ICN\ncf-cache-status: HIT\n";

        TechProfile p = detector.detect(headers, "<html></html>");

        assertThat(p.get(Category.CDN)).contains("Cloudflare");
        assertThat(p.get(Category.SECURITY)).contains("Cloudflare Bot Management");
        assertThat(p.get(Category.CACHING)).contains("Cloudflare Cache");
        assertThat(p.get(Category.HOSTING)).doesNotContain("Cloudflare Pages");
    }

    @Test
    void cloudflarePagesNeedsBothHeaderAndBody() {
        String headers = "HTTP/2 200\ncf-ray: 1-ICN\n";
        assertThat(detector.detect(headers, "<a href=\"https://demo.pages.dev\">x</a>").get(Category.HOSTING))
                .contains("Cloudflare Pages");
        assertThat(detector.detect("HTTP/2 200\n", "<a href=\"https://demo.pages.dev\">x</a>").get(Category.HOSTING))
                .doesNotContain("Cloudflare Pages");
    }

    @Test
    void newRelicApmStaysInPerformance() {
        TechProfile p = detector.detect("", "<!-- newrelic apm -->");

        assertThat(p.get(Category.PERFORMANCE)).contains("New Relic");
        assertThat(p.get(Category.RUM)).doesNotContain("New Relic Browser");
    }

    @Test
    void newRelicBrowserAgentMovesToRum() {
        String body = "<script>window.NREUM||(NREUM={});</script>"
                + "<script src=\"https://js-agent.newrelic.com/nr-1234.min.js\"></script>";

        TechProfile p = detector.detect("", body);

        assertThat(p.get(Category.PERFORMANCE)).doesNotContain("New Relic");
        assertThat(p.get(Category.RUM)).containsOnlyOnce("New Relic Browser");
    }

    @Test
    void http3SuppressesHttp2() {
        TechProfile both = detector.detect("HTTP/2 200\nalt-svc: h3-29=\":443\"\n", "");
        assertThat(both.get(Category.MISCELLANEOUS)).contains("HTTP/3").doesNotContain("HTTP/2");

        TechProfile h2 = detector.detect("HTTP/2 200\nserver: x\n", "");
        assertThat(h2.get(Category.MISCELLANEOUS)).contains("HTTP/2").doesNotContain("HTTP/3");
    }

    @Test
    void patternDoesNotSpanLines() {
        // "via.*apache"는 한 줄 안에서만 매치
        TechProfile p = detector.detect("HTTP/1.1 200 OK\nvia: 1.1 proxy\nx-backend: apache\n", "");
        assertThat(p.get(Category.REVERSE_PROXIES)).doesNotContain("Apache");
    }

    @Test
    void sameTechnologyFromTwoSignaturesIsKeptOnce() {
        SignatureRuleSet rules = new SignatureRuleSet(List.of(
                new Signature(Category.CDN, "Fastly", MatchRule.headers("x-served-by")),
                new Signature(Category.CDN, "Fastly", MatchRule.body("fastly"))
        ), List.of());

        TechProfile p = new TechDetector(rules).detect("x-served-by: cache-fra\n", "fastly.net");

        assertThat(p.get(Category.CDN)).containsExactly("Fastly");
    }

    @Test
    void concurrentCallsGiveSameResult() {
        String headers = "HTTP/2 200\nserver: nginx\nx-powered-by: PHP/8.2\n";
        String body = "<script src=\"https://cdn.jsdelivr.net/npm/bootstrap/dist/js/bootstrap.min.js\"></script>";
        TechProfile expected = detector.detect(headers, body);

        List<TechProfile> results = IntStream.range(0, 64).parallel()
                .mapToObj(i -> detector.detect(headers, body))
                .toList();

        assertThat(results).allSatisfy(p -> assertThat(p).isEqualTo(expected));
        assertThat(expected.get(Category.PROGRAMMING_LANGUAGES)).contains("PHP");
        assertThat(expected.get(Category.UI_FRAMEWORKS)).contains("Bootstrap");
        assertThat(expected.get(Category.CDN)).contains("jsDelivr");
    }
}
