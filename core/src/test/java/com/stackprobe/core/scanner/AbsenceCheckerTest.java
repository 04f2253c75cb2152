package com.stackprobe.core.scanner;

import com.stackprobe.core.model.MissingReport;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AbsenceCheckerTest {

    private static final String FULL_META = String.join("\n",
            "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">",
            "<meta name=\"description\" content=\"demo\">",
            "<link rel=\"canonical\" href=\"https://example.com/\">",
            "<meta property=\"og:title\" content=\"demo\">",
            "<meta name='twitter:card' content='summary'>",
            "<meta name=\"theme-color\" content=\"#ffffff\">");

    private final AbsenceChecker checker = new AbsenceChecker();

    private static Map<String, Boolean> allProbes(boolean exists) {
        Map<String, Boolean> m = new HashMap<>();
        for (String name : AbsenceChecker.FILE_PROBES.keySet()) m.put(name, exists);
        return m;
    }

    @Test
    void noSecurityHeadersReportsAllSixInOrder() {
        MissingReport r = checker.checkMissing("HTTP/1.1 200 OK\nserver: nginx\n", FULL_META, allProbes(true));

        assertThat(r.getSecurity()).containsExactly(
                "Strict-Transport-Security",
                "Content-Security-Policy",
                "X-Content-Type-Options",
                "X-Frame-Options",
                "Referrer-Policy",
                "Permissions-Policy");
        assertThat(r.getFiles()).isEmpty();
        assertThat(r.getMetaTags()).isEmpty();
    }

    @Test
    void presentHeadersAreNotReported() {
        String headers = "HTTP/2 200\n"
                + "strict-transport-security: max-age=31536000\n"
                + "X-Frame-Options: DENY\n"
                + "referrer-policy: no-referrer\n";

        MissingReport r = checker.checkMissing(headers, "", allProbes(true));

        assertThat(r.getSecurity()).containsExactly(
                "Content-Security-Policy", "X-Content-Type-Options", "Permissions-Policy");
    }

    @Test
    void onlyFalseProbesAreReportedMissing() {
        Map<String, Boolean> probes = new LinkedHashMap<>();
        probes.put("robots.txt", true);
        probes.put("favicon.ico", true);
        probes.put("humans.txt", false);

        MissingReport r = checker.checkMissing("", "", probes);

        // 점검하지 않은 파일(sitemap.xml 등)은 누락으로 보지 않는다
        assertThat(r.getFiles()).containsExactly("humans.txt");
    }

    @Test
    void suppliedProbeOutsideDefaultListIsReported() {
        Map<String, Boolean> probes = new LinkedHashMap<>();
        probes.put("ads.txt", false);
        probes.put("robots.txt", true);

        MissingReport r = checker.checkMissing("", "", probes);

        assertThat(r.getFiles()).containsExactly("ads.txt");
    }

    @Test
    void emptyOrNullProbeMapMeansFilesNotChecked() {
        assertThat(checker.checkMissing("", "", Map.of()).getFiles()).isEmpty();
        assertThat(checker.checkMissing("", "", null).getFiles()).isEmpty();
    }

    @Test
    void allProbesAbsentReportsEveryFileInOrder() {
        MissingReport r = checker.checkMissing("", "", AbsenceChecker.allProbesAbsent());
        assertThat(r.getFiles()).containsExactlyElementsOf(AbsenceChecker.FILE_PROBES.keySet());
    }

    @Test
    void emptyBodyReportsEveryMetaTag() {
        MissingReport r = checker.checkMissing("", "", allProbes(true));

        assertThat(r.getMetaTags()).containsExactly(
                "viewport", "description", "canonical", "Open Graph tags", "Twitter Card tags", "theme-color");
    }

    @Test
    void everythingPresentYieldsThreeEmptySets() {
        String headers = "HTTP/2 200\n"
                + "strict-transport-security: max-age=1\n"
                + "content-security-policy: default-src 'self'\n"
                + "x-content-type-options: nosniff\n"
                + "x-frame-options: SAMEORIGIN\n"
                + "referrer-policy: strict-origin\n"
                + "permissions-policy: camera=()\n";

        MissingReport r = checker.checkMissing(headers, FULL_META, allProbes(true));

        assertThat(r).isEqualTo(MissingReport.none());
    }

    @Test
    void descriptionFoundRegardlessOfAttributeOrder() {
        MissingReport r = checker.checkMissing("", "<meta content=\"x\" name=\"description\">", Map.of());
        assertThat(r.getMetaTags()).doesNotContain("description");

        MissingReport og = checker.checkMissing("", "<meta property=\"og:description\" content=\"x\">", Map.of());
        assertThat(og.getMetaTags()).contains("description");
    }
}
