package com.filterduck.runtime;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;
import com.filterduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Zone Time Settings Tests")
class ZoneTimeSettingsTest {

    @Test
    @DisplayName("UTC to UTC keeps the wall clock and adds Z")
    void testUtc() {
        assertThat(ZoneTimeSettings.utc(3).inDbTimeZone("2023-01-05T00:00:00.000"))
            .isEqualTo("2023-01-05T00:00:00.000Z");
        assertThat(ZoneTimeSettings.utc(6).inDbTimeZone("2023-01-05T23:59:59.999999"))
            .isEqualTo("2023-01-05T23:59:59.999999Z");
    }

    @Test
    @DisplayName("Query zone wall clock is shifted into the database zone")
    void testConversion() {
        TimeSettings settings = new ZoneTimeSettings(3, ZoneId.of("America/New_York"), ZoneOffset.UTC);

        assertThat(settings.inDbTimeZone("2023-01-05T00:00:00.000")).isEqualTo("2023-01-05T05:00:00.000Z");
        // daylight saving time
        assertThat(settings.inDbTimeZone("2023-07-05T00:00:00.000")).isEqualTo("2023-07-05T04:00:00.000Z");
    }

    @Test
    @DisplayName("Non-UTC database zone keeps its offset")
    void testDatabaseOffset() {
        ZoneTimeSettings settings = new ZoneTimeSettings(3, ZoneOffset.UTC, ZoneId.of("Asia/Tokyo"));

        assertThat(settings.queryZone()).isEqualTo(ZoneOffset.UTC);
        assertThat(settings.databaseZone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
        assertThat(settings.inDbTimeZone("2023-01-05T00:00:00.000")).isEqualTo("2023-01-05T09:00:00.000+09:00");
    }

    @Test
    @DisplayName("Unparseable timestamps fail")
    void testInvalidTimestamp() {
        assertThatThrownBy(() -> ZoneTimeSettings.utc(3).inDbTimeZone("2023-13-45T00:00:00.000"))
            .isInstanceOfSatisfying(FilterCompilationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNRECOGNIZED_DATE_FORMAT));
    }

    @Test
    @DisplayName("Out of range precision fails")
    void testInvalidPrecision() {
        assertThatThrownBy(() -> ZoneTimeSettings.utc(0).inDbTimeZone("2023-01-05T00:00:00.000"))
            .isInstanceOfSatisfying(FilterCompilationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_PRECISION));
    }
}
