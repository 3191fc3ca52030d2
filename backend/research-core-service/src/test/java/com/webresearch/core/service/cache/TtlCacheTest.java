package com.webresearch.core.service.cache;

import com.webresearch.core.MutableClock;
import com.webresearch.core.dto.cache.CacheEntry;
import com.webresearch.core.dto.cache.CacheStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TtlCache 단위 테스트
 */
class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        cache = new TtlCache<>("test", 3, Duration.ofMinutes(10), clock);
    }

    @Nested
    @DisplayName("TTL")
    class Expiry {

        @Test
        @DisplayName("TTL 이전에는 값을 반환한다")
        void returnsValueBeforeExpiry() {
            // given
            cache.set("a", "alpha");
            clock.advance(Duration.ofMinutes(9));

            // when / then
            assertThat(cache.get("a")).contains("alpha");
            assertThat(cache.has("a")).isTrue();
        }

        @Test
        @DisplayName("만료된 항목은 miss로 취급되고 제거된다")
        void expiredEntryIsMissAndRemoved() {
            // given
            cache.set("a", "alpha");
            clock.advance(Duration.ofMinutes(11));

            // when / then
            assertThat(cache.get("a")).isEmpty();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("항목별 TTL이 기본 TTL보다 우선한다")
        void perEntryTtlOverridesDefault() {
            // given
            cache.set("short", "s", Duration.ofSeconds(5));
            cache.set("long", "l");
            clock.advance(Duration.ofSeconds(6));

            // when / then
            assertThat(cache.has("short")).isFalse();
            assertThat(cache.has("long")).isTrue();
        }

        @Test
        @DisplayName("cleanup은 만료된 항목 수를 반환한다")
        void cleanupCountsExpired() {
            // given
            cache.set("a", "alpha", Duration.ofSeconds(1));
            cache.set("b", "beta", Duration.ofSeconds(1));
            cache.set("c", "gamma");
            clock.advance(Duration.ofSeconds(2));

            // when
            int removed = cache.cleanup();

            // then
            assertThat(removed).isEqualTo(2);
            assertThat(cache.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("용량 제한")
    class Eviction {

        @Test
        @DisplayName("가득 차면 조회 횟수가 가장 적은 항목을 내보낸다")
        void evictsLeastFrequentlyUsed() {
            // given
            cache.set("a", "alpha");
            cache.set("b", "beta");
            cache.set("c", "gamma");
            cache.get("a");
            cache.get("a");
            cache.get("c");

            // when
            cache.set("d", "delta");

            // then
            assertThat(cache.size()).isEqualTo(3);
            assertThat(cache.has("b")).isFalse();
            assertThat(cache.has("a")).isTrue();
            assertThat(cache.has("c")).isTrue();
            assertThat(cache.has("d")).isTrue();
        }

        @Test
        @DisplayName("조회 횟수가 같으면 먼저 들어온 항목을 내보낸다")
        void tieGoesToOldestEntry() {
            // given
            cache.set("a", "alpha");
            cache.set("b", "beta");
            cache.set("c", "gamma");

            // when
            cache.set("d", "delta");

            // then
            assertThat(cache.has("a")).isFalse();
        }

        @Test
        @DisplayName("기존 키를 덮어쓰면 아무것도 내보내지 않는다")
        void overwriteDoesNotEvict() {
            // given
            cache.set("a", "alpha");
            cache.set("b", "beta");
            cache.set("c", "gamma");

            // when
            cache.set("b", "beta-2");

            // then
            assertThat(cache.size()).isEqualTo(3);
            assertThat(cache.get("b")).contains("beta-2");
        }

        @Test
        @DisplayName("용량이 0 이하이면 생성할 수 없다")
        void rejectsNonPositiveCapacity() {
            assertThatThrownBy(() -> new TtlCache<String>("bad", 0, Duration.ofMinutes(1), clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("통계와 내보내기")
    class StatsAndExport {

        @Test
        @DisplayName("hitRate는 총 조회 수 / 항목 수, avgAge는 평균 경과 시간이다")
        void statsReflectHitsAndAge() {
            // given
            cache.set("a", "alpha");
            clock.advance(Duration.ofSeconds(10));
            cache.set("b", "beta");
            cache.get("a");
            cache.get("a");
            cache.get("b");

            // when
            CacheStats stats = cache.stats();

            // then
            assertThat(stats.size()).isEqualTo(2);
            assertThat(stats.hitRate()).isEqualTo(1.5);
            assertThat(stats.avgAgeMs()).isEqualTo(5_000);
        }

        @Test
        @DisplayName("export는 살아있는 항목만, import는 만료된 항목을 버린다")
        void exportAndImportSkipExpired() {
            // given
            cache.set("a", "alpha", Duration.ofSeconds(1));
            cache.set("b", "beta");
            clock.advance(Duration.ofSeconds(2));
            List<CacheEntry<String>> exported = cache.export();

            long now = clock.millis();
            TtlCache<String> restored = new TtlCache<>("restored", 3, Duration.ofMinutes(10), clock);
            CacheEntry<String> stale = new CacheEntry<>("old", "stale", now - 10_000, now - 1, 1, 0);

            // when
            int loaded = restored.importEntries(List.of(exported.get(0), stale));

            // then
            assertThat(exported).extracting(CacheEntry::getKey).containsExactly("b");
            assertThat(loaded).isEqualTo(1);
            assertThat(restored.get("b")).contains("beta");
            assertThat(restored.has("old")).isFalse();
        }
    }
}
