package com.stackprobe.core.scanner;

import com.stackprobe.core.model.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.stackprobe.core.model.Category.*;
import static com.stackprobe.core.scanner.MatchRule.any;
import static com.stackprobe.core.scanner.MatchRule.body;
import static com.stackprobe.core.scanner.MatchRule.headers;

/**
 * 선언형 시그니처 테이블 + 카테고리 예외 규칙 목록.
 * 엔진(TechDetector)은 이 테이블만 순회하므로 규칙 추가 시 엔진 수정이 필요 없다.
 * 커버리지는 대표 벤더 위주(완전한 핑거프린트 DB가 아님).
 */
public final class SignatureRuleSet {

    private final List<Signature> signatures;
    private final Map<Category, List<Signature>> byCategory;
    private final List<SignatureOverride> overrides;

    public SignatureRuleSet(List<Signature> signatures, List<SignatureOverride> overrides) {
        this.signatures = List.copyOf(Objects.requireNonNull(signatures, "signatures"));
        this.overrides = List.copyOf(Objects.requireNonNull(overrides, "overrides"));

        EnumMap<Category, List<Signature>> m = new EnumMap<>(Category.class);
        for (Category c : Category.values()) m.put(c, new ArrayList<>());
        for (Signature s : this.signatures) m.get(s.category()).add(s);
        m.replaceAll((c, l) -> List.copyOf(l));
        this.byCategory = Collections.unmodifiableMap(m);
    }

    public List<Signature> signatures() { return signatures; }
    public List<Signature> forCategory(Category c) { return byCategory.get(c); }
    public List<SignatureOverride> overrides() { return overrides; }

    // ================= 기본 규칙 세트 =================

    private static final SignatureRuleSet DEFAULTS = new SignatureRuleSet(defaultSignatures(), defaultOverrides());

    public static SignatureRuleSet defaults() { return DEFAULTS; }

    private static List<SignatureOverride> defaultOverrides() {
        return List.of(
                // New Relic: 브라우저 에이전트 흔적이 있으면 performance가 아니라 rum
                SignatureOverride.redirect(PERFORMANCE, "New Relic",
                        body("browser-agent|NREUM"),
                        RUM, "New Relic Browser"),
                // HTTP/3가 보이면 HTTP/2는 보고하지 않음
                SignatureOverride.suppress(MISCELLANEOUS, "HTTP/2",
                        headers("HTTP/3|h3-"))
        );
    }

    private static List<Signature> defaultSignatures() {
        List<Signature> l = new ArrayList<>(128);

        // --- CMS ---
        l.add(sig(CMS, "WordPress", body("wp-content|wp-includes|wordpress")));
        l.add(sig(CMS, "Drupal", body("drupal|sites/default/files")));
        l.add(sig(CMS, "Joomla", body("/components/com_|Joomla!")));
        l.add(sig(CMS, "Umbraco", body("umbraco|/media/[a-z0-9]{6,}/")));
        l.add(sig(CMS, "Shopify", body("cdn\\.shopify\\.com|myshopify\\.com")));
        l.add(sig(CMS, "Wix", body("wix\\.com|wixstatic\\.com")));
        l.add(sig(CMS, "Squarespace", body("squarespace")));
        l.add(sig(CMS, "Webflow", body("webflow")));
        l.add(sig(CMS, "Sitecore", body("\"sitecore\":|__JSS_STATE__|/sitecore/|/jssmedia/")));
        l.add(sig(CMS, "Optimizely", body("window\\.optimizely|cdn\\.optimizely\\.com|episerver")));

        // --- JavaScript 프레임워크 ---
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "React", body("react|_react|data-reactroot")));
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "Vue.js", body("vue\\.js|data-v-|__vue__")));
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "Angular", body("ng-|angular|data-ng-")));
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "Next.js", body("next\\.js|_next/")));
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "Nuxt.js", body("nuxt|__nuxt")));
        l.add(sig(JAVASCRIPT_FRAMEWORKS, "Svelte", body("svelte")));

        // --- JavaScript 라이브러리 ---
        l.add(sig(JAVASCRIPT_LIBRARIES, "jQuery", body("jquery")));
        l.add(sig(JAVASCRIPT_LIBRARIES, "Lodash", body("lodash")));
        l.add(sig(JAVASCRIPT_LIBRARIES, "Moment.js", body("moment\\.js")));
        l.add(sig(JAVASCRIPT_LIBRARIES, "Boomerang", body("boomerang")));
        l.add(sig(JAVASCRIPT_LIBRARIES, "GSAP", body("gsap|greensock")));

        // --- UI 프레임워크 ---
        l.add(sig(UI_FRAMEWORKS, "Bootstrap", body("bootstrap")));
        l.add(sig(UI_FRAMEWORKS, "Tailwind CSS", body("tailwind")));
        l.add(sig(UI_FRAMEWORKS, "Foundation", body("foundation")));
        l.add(sig(UI_FRAMEWORKS, "Material-UI", body("material-ui|@mui")));
        l.add(sig(UI_FRAMEWORKS, "Bulma", body("bulma")));

        // --- 웹 프레임워크(서버측) ---
        l.add(sig(WEB_FRAMEWORKS, "Microsoft ASP.NET",
                any("x-powered-by.*ASP\\.NET|x-aspnet-version|__VIEWSTATE|\\.AspNetCore")));
        l.add(sig(WEB_FRAMEWORKS, "Laravel", any("laravel_session|laravel.*token")));
        l.add(sig(WEB_FRAMEWORKS, "Django", body("csrfmiddlewaretoken|django").or(headers("X-Django"))));
        l.add(sig(WEB_FRAMEWORKS, "Ruby on Rails", any("_session.*rails|csrf-token.*rails|X-Runtime")));
        l.add(sig(WEB_FRAMEWORKS, "Express.js", headers("x-powered-by.*Express")));
        l.add(sig(WEB_FRAMEWORKS, "Flask", any("flask|werkzeug")));
        l.add(sig(WEB_FRAMEWORKS, "Spring Framework", any("spring|jsessionid")));

        // --- 프로그래밍 언어 ---
        l.add(sig(PROGRAMMING_LANGUAGES, "PHP", any("x-powered-by.*PHP|\\.php|phpsessid")));
        l.add(sig(PROGRAMMING_LANGUAGES, "Node.js", headers("x-powered-by.*Express|x-powered-by.*Next\\.js")));
        l.add(sig(PROGRAMMING_LANGUAGES, "Python", any("django|flask|werkzeug")));
        l.add(sig(PROGRAMMING_LANGUAGES, "Ruby", any("rails|rack")));
        l.add(sig(PROGRAMMING_LANGUAGES, "C#", headers("x-powered-by.*ASP\\.NET|x-aspnet-version|\\.AspNetCore")));
        l.add(sig(PROGRAMMING_LANGUAGES, "Java", any("jsessionid|spring|jboss|tomcat")));

        // --- 분석 ---
        l.add(sig(ANALYTICS, "Google Analytics",
                body("google-analytics|googletagmanager|gtag|ga\\.js|analytics\\.js")));
        l.add(sig(ANALYTICS, "Adobe Analytics", body("omniture|adobe.*analytics")));
        l.add(sig(ANALYTICS, "Matomo", body("matomo|piwik")));
        l.add(sig(ANALYTICS, "Hotjar", body("hotjar")));
        l.add(sig(ANALYTICS, "Mixpanel", body("mixpanel")));

        // --- 태그 매니저 ---
        l.add(sig(TAG_MANAGERS, "Google Tag Manager", body("googletagmanager\\.com/gtm")));
        l.add(sig(TAG_MANAGERS, "Adobe Tag Manager", body("adobe.*tag.*manager")));
        l.add(sig(TAG_MANAGERS, "Tealium", body("tealium")));

        // --- CDN ---
        l.add(sig(CDN, "Cloudflare", any("cloudflare")));
        l.add(sig(CDN, "Akamai", body("akamai")));
        l.add(sig(CDN, "Fastly", any("fastly")));
        l.add(sig(CDN, "Amazon CloudFront", body("cloudfront")));
        l.add(sig(CDN, "jsDelivr", body("jsdelivr")));
        l.add(sig(CDN, "unpkg", body("unpkg\\.com")));

        // --- 캐싱 ---
        l.add(sig(CACHING, "Varnish", headers("x-varnish|via.*varnish")));
        l.add(sig(CACHING, "Redis", headers("x-redis|redis")));
        l.add(sig(CACHING, "Memcached", headers("memcached")));
        l.add(sig(CACHING, "Cloudflare Cache", headers("cf-cache-status")));
        l.add(sig(CACHING, "Fastly", headers("x-served-by.*fastly|fastly-io")));

        // --- 리버스 프록시 ---
        l.add(sig(REVERSE_PROXIES, "Nginx", headers("server.*nginx")));
        l.add(sig(REVERSE_PROXIES, "Varnish", headers("x-varnish|via.*varnish")));
        l.add(sig(REVERSE_PROXIES, "HAProxy", headers("haproxy")));
        l.add(sig(REVERSE_PROXIES, "Apache", headers("via.*apache")));

        // --- 폰트 ---
        l.add(sig(FONT_SCRIPTS, "Google Fonts", body("fonts\\.googleapis\\.com|fonts\\.gstatic\\.com")));
        l.add(sig(FONT_SCRIPTS, "Adobe Fonts", body("typekit|use\\.typekit")));
        l.add(sig(FONT_SCRIPTS, "Font Awesome", body("fontawesome|font-awesome")));

        // --- 보안 ---
        l.add(sig(SECURITY, "HSTS", headers("strict-transport-security")));
        l.add(sig(SECURITY, "Cloudflare Bot Management", headers("cloudflare.*bot|cf-ray")));
        l.add(sig(SECURITY, "reCAPTCHA", body("recaptcha")));
        l.add(sig(SECURITY, "Content Security Policy", headers("content-security-policy")));

        // --- 쿠키 동의 ---
        l.add(sig(COOKIE_COMPLIANCE, "OneTrust", body("onetrust")));
        l.add(sig(COOKIE_COMPLIANCE, "Cookiebot", body("cookiebot")));
        l.add(sig(COOKIE_COMPLIANCE, "Cookie Consent", body("cookieconsent")));

        // --- RUM ---
        l.add(sig(RUM, "Boomerang", body("boomerang")));
        l.add(sig(RUM, "Akamai mPulse", body("mpulse|go-mpulse\\.net")));
        l.add(sig(RUM, "New Relic Browser", body("browser-agent|NREUM|js-agent\\.newrelic\\.com")));
        l.add(sig(RUM, "Google Analytics RUM", body("google-analytics.*rum|gtag.*measurement")));

        // --- 성능 ---
        l.add(sig(PERFORMANCE, "Priority Hints", body("fetchpriority|importance=")));
        l.add(sig(PERFORMANCE, "New Relic", body("newrelic")));   // 예외 규칙 대상

        // --- 호스팅 ---
        l.add(sig(HOSTING, "Amazon Web Services", any("x-amz-|amazonaws\\.com|cloudfront")));
        l.add(sig(HOSTING, "Microsoft Azure", any("azure|windows\\.net")));
        l.add(sig(HOSTING, "Google Cloud Platform", any("gcp|google.*cloud|appengine")));
        l.add(sig(HOSTING, "Cloudflare Pages", headers("cf-ray").and(body("pages\\.dev"))));
        l.add(sig(HOSTING, "Vercel", any("x-vercel|vercel\\.com")));
        l.add(sig(HOSTING, "Netlify", any("x-nf-|netlify\\.com")));
        l.add(sig(HOSTING, "GitHub Pages", body("github\\.io|pages\\.github\\.com")));
        l.add(sig(HOSTING, "Heroku", any("herokuapp\\.com")));

        // --- 기타 ---
        l.add(sig(MISCELLANEOUS, "Open Graph", body("og:title|og:description|property=\"og:")));
        l.add(sig(MISCELLANEOUS, "HTTP/3", headers("HTTP/3|h3-")));
        l.add(sig(MISCELLANEOUS, "HTTP/2", headers("HTTP/2")));   // 예외 규칙 대상

        return l;
    }

    private static Signature sig(Category c, String technology, MatchRule rule) {
        return new Signature(c, technology, rule);
    }
}
