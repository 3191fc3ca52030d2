package com.webresearch.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "https://www.Acme.com/Pricing/, https://acme.com/pricing",
            "https://acme.com/pricing?plan=pro#top, https://acme.com/pricing",
            "http://acme.com:8080/docs, http://acme.com:8080/docs",
            "https://acme.com/, https://acme.com",
            "Not A Url, not a url"
    })
    @DisplayName("쿼리, 프래그먼트, 끝 슬래시, www를 제거하고 소문자로 만든다")
    void normalize(String url, String expected) {
        assertThat(UrlNormalizer.normalize(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("도메인 추출")
    void extractDomain() {
        assertThat(UrlNormalizer.extractDomain("https://www.GitHub.com/acme/repo")).isEqualTo("github.com");
        assertThat(UrlNormalizer.extractDomain("acme.io")).isEqualTo("acme.io");
        assertThat(UrlNormalizer.extractDomain(null)).isEmpty();
    }

    @Test
    @DisplayName("도메인 정규화")
    void normalizeDomain() {
        assertThat(UrlNormalizer.normalizeDomain("  WWW.Acme.io ")).isEqualTo("acme.io");
    }
}
