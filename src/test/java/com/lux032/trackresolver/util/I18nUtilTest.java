package com.lux032.trackresolver.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class I18nUtilTest {

    @AfterEach
    void restoreDefaultLanguage() {
        I18nUtil.init("en_US");
    }

    @Test
    void formatsPlaceholdersInOrder() {
        I18nUtil.init("en_US");

        assertThat(I18nUtil.getMessage("resolve.not.found", "Spotify")).isEqualTo("No match found on Spotify");
        assertThat(I18nUtil.getMessage("replace.retrying", 2, 2, 3))
            .isEqualTo("2 track(s) still unresolved, attempt 2 of 3");
    }

    @Test
    void switchesLanguage() {
        I18nUtil.init("zh_CN");

        assertThat(I18nUtil.getCurrentLanguage()).isEqualTo("zh_CN");
        assertThat(I18nUtil.getMessage("resolve.not.found", "Spotify")).isEqualTo("在 Spotify 上未找到匹配");
    }

    @Test
    void unknownLanguageFallsBackToEnglish() {
        I18nUtil.init("xx_YY");

        assertThat(I18nUtil.getCurrentLanguage()).isEqualTo("en_US");
        assertThat(I18nUtil.getMessage("verify.missing.fields")).isEqualTo("Skipped: missing artist or title");
    }

    @Test
    void missingKeyReturnsKey() {
        assertThat(I18nUtil.getMessage("no.such.key")).isEqualTo("no.such.key");
    }

    @Test
    void extraPlaceholdersStayLiteral() {
        assertThat(I18nUtil.format("{} and {}", "one")).isEqualTo("one and {}");
        assertThat(I18nUtil.format("plain")).isEqualTo("plain");
    }
}
