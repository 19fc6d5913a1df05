package com.cspsmith.core.resource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainExtractorTest {

    @Test
    void absoluteUrlsKeepSchemeHostAndPort() {
        assertThat(DomainExtractor.extract("https://cdn.example.com/lib/app.js?v=2#x"))
                .isEqualTo("https://cdn.example.com");
        assertThat(DomainExtractor.extract("http://Example.COM:8080/a"))
                .isEqualTo("http://example.com:8080");
    }

    @Test
    void protocolRelativeBecomesHttps() {
        assertThat(DomainExtractor.extract("//cdn.example.com/file.js"))
                .isEqualTo("https://cdn.example.com");
    }

    @Test
    void dataAndRelativeAreNotAddressable() {
        assertThat(DomainExtractor.extract("data:image/png;base64,AA")).isEmpty();
        assertThat(DomainExtractor.extract("/static/app.js")).isEmpty();
        assertThat(DomainExtractor.extract("img/logo.png")).isEmpty();
        assertThat(DomainExtractor.extract("ftp://files.example.com/a")).isEmpty();
        assertThat(DomainExtractor.extract(null)).isEmpty();
    }

    @Test
    void malformedInputDegradesToEmpty() {
        assertThat(DomainExtractor.extract("https://")).isEmpty();
        assertThat(DomainExtractor.extract("http:///path-only")).isEmpty();
    }

    @Test
    void authorityWithBadPortOrHostCharactersIsRejected() {
        assertThat(DomainExtractor.extract("http://host:abc/x.js")).isEmpty();
        assertThat(DomainExtractor.extract("https://bad!host.example.com/a.js")).isEmpty();
        // 밑줄 호스트에 숫자 포트는 그대로 유지
        assertThat(DomainExtractor.extract("http://my_host.example.com:8080/x"))
                .isEqualTo("http://my_host.example.com:8080");
    }

    @Test
    void lenientForOddPathsAndHosts() {
        // 경로에 공백이 있어도 origin 은 뽑는다
        assertThat(DomainExtractor.extract("https://cdn.example.com/my file.js"))
                .isEqualTo("https://cdn.example.com");
        // 밑줄 호스트는 URI host 가 null → authority 사용
        assertThat(DomainExtractor.extract("https://my_host.example.com/a.js"))
                .isEqualTo("https://my_host.example.com");
        // userinfo 제거
        assertThat(DomainExtractor.extract("https://user:pw@host.example.com/p"))
                .isEqualTo("https://host.example.com");
    }
}
