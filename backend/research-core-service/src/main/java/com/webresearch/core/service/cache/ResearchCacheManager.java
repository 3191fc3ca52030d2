package com.webresearch.core.service.cache;

import com.webresearch.core.config.ResearchProperties;
import com.webresearch.core.dto.cache.CacheManagerStats;
import com.webresearch.core.dto.cache.CacheState;
import com.webresearch.core.dto.cache.CachedPage;
import com.webresearch.core.dto.cache.CleanupResult;
import com.webresearch.core.dto.cache.DomainMapEntry;
import com.webresearch.core.dto.cache.MemoryEstimate;
import com.webresearch.core.dto.claim.ExtractionResult;
import com.webresearch.core.util.ContentHasher;
import com.webresearch.core.util.UrlNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Research Cache Manager
 *
 * 페이지/추출 결과/도메인 탐색 지식/쿼리 결과를 TTL 기반으로 캐싱합니다.
 * - 페이지: 100건, 30분 TTL
 * - 추출 결과, 쿼리 -> URL: 1,000건, 1시간 TTL
 * - 도메인 맵: 1,000건, 24시간 TTL
 *
 * Page and extraction keys are normalized URLs; query keys are content hashes.
 */
@Service
@Slf4j
public class ResearchCacheManager {

    private static final int PAGE_VERSION = 1;

    private static final long PAGE_BYTES = 50_000;
    private static final long EXTRACTION_BYTES = 2_000;
    private static final long DOMAIN_BYTES = 500;
    private static final long QUERY_BYTES = 200;

    private final Clock clock;
    private final ResearchProperties.Cache settings;

    private final TtlCache<CachedPage> pageCache;
    private final TtlCache<List<ExtractionResult>> extractionCache;
    private final TtlCache<DomainMapEntry> domainMap;
    private final TtlCache<List<String>> queryCache;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Counter hitCounter;
    private final Counter missCounter;

    public ResearchCacheManager(ResearchProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.settings = properties.getCache();
        this.pageCache = new TtlCache<>("page", settings.getPage().getMaxSize(), settings.getPage().getTtl(), clock);
        this.extractionCache = new TtlCache<>("extraction", settings.getExtraction().getMaxSize(),
                settings.getExtraction().getTtl(), clock);
        this.domainMap = new TtlCache<>("domain-map", settings.getDomainMap().getMaxSize(),
                settings.getDomainMap().getTtl(), clock);
        this.queryCache = new TtlCache<>("query", settings.getQuery().getMaxSize(), settings.getQuery().getTtl(), clock);

        this.hitCounter = Counter.builder("research.cache.hits")
                .description("Cache lookups answered from memory")
                .register(meterRegistry);
        this.missCounter = Counter.builder("research.cache.misses")
                .description("Cache lookups that missed or found an expired entry")
                .register(meterRegistry);
    }

    // ============================================
    // Page cache
    // ============================================

    public Optional<CachedPage> getPage(String url) {
        return record(pageCache.get(UrlNormalizer.normalize(url)), "page", url);
    }

    public void setPage(String url, String html, String text) {
        setPage(url, html, text, null);
    }

    public void setPage(String url, String html, String text, Map<String, Object> extractedData) {
        CachedPage page = new CachedPage(url, html, text, extractedData, clock.millis(),
                settings.getPage().getTtl().toMillis(), PAGE_VERSION);
        pageCache.set(UrlNormalizer.normalize(url), page);
        log.debug("Cached page: url='{}'", url);
    }

    public boolean hasPage(String url) {
        return pageCache.has(UrlNormalizer.normalize(url));
    }

    // ============================================
    // Extraction cache
    // ============================================

    public Optional<List<ExtractionResult>> getExtractions(String url) {
        return record(extractionCache.get(UrlNormalizer.normalize(url)), "extractions", url);
    }

    public void setExtractions(String url, List<ExtractionResult> extractions) {
        extractionCache.set(UrlNormalizer.normalize(url), List.copyOf(extractions));
        log.debug("Cached extractions: url='{}', count={}", url, extractions.size());
    }

    // ============================================
    // Domain map
    // ============================================

    public Optional<DomainMapEntry> getDomainMap(String domain) {
        return domainMap.get(UrlNormalizer.normalizeDomain(domain));
    }

    /**
     * Merge newly observed high-signal URLs into the domain's known set.
     * Navigation paths are replaced when given and kept otherwise.
     */
    public synchronized void updateDomainMap(String domain, List<String> highSignalUrls, List<String> navigationPaths) {
        String key = UrlNormalizer.normalizeDomain(domain);
        Optional<DomainMapEntry> existing = domainMap.get(key);

        Set<String> urls = new LinkedHashSet<>();
        existing.ifPresent(entry -> urls.addAll(entry.highSignalUrls()));
        if (highSignalUrls != null) {
            urls.addAll(highSignalUrls);
        }

        List<String> paths;
        if (navigationPaths != null) {
            paths = List.copyOf(navigationPaths);
        } else {
            paths = existing.map(DomainMapEntry::navigationPaths).orElse(List.of());
        }

        domainMap.set(key, new DomainMapEntry(key, List.copyOf(urls), paths, clock.millis()),
                settings.getDomainMap().getTtl());
    }

    public List<String> getHighSignalUrls(String domain) {
        return getDomainMap(domain).map(DomainMapEntry::highSignalUrls).orElse(List.of());
    }

    // ============================================
    // Query cache
    // ============================================

    public Optional<List<String>> getQueryResults(String query) {
        return record(queryCache.get(queryKey(query)), "query", query);
    }

    public void setQueryResults(String query, List<String> urls) {
        queryCache.set(queryKey(query), List.copyOf(urls));
    }

    private String queryKey(String query) {
        return ContentHasher.hash(query.toLowerCase(Locale.ROOT));
    }

    // ============================================
    // Management
    // ============================================

    public CacheManagerStats getStats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;
        return new CacheManagerStats(
                total > 0 ? (double) hitCount / total : 0,
                hitCount,
                missCount,
                pageCache.stats(),
                extractionCache.stats(),
                domainMap.size(),
                queryCache.size()
        );
    }

    public CleanupResult cleanup() {
        CleanupResult result = new CleanupResult(
                pageCache.cleanup(),
                extractionCache.cleanup(),
                domainMap.cleanup(),
                queryCache.cleanup()
        );
        if (result.total() > 0) {
            log.debug("Removed {} expired cache entries", result.total());
        }
        return result;
    }

    public void clear() {
        pageCache.clear();
        extractionCache.clear();
        domainMap.clear();
        queryCache.clear();
        resetCounters();
        log.info("Research caches cleared");
    }

    public void resetCounters() {
        hits.set(0);
        misses.set(0);
    }

    public CacheState exportState() {
        return new CacheState(
                pageCache.export(),
                extractionCache.export(),
                domainMap.export(),
                queryCache.export()
        );
    }

    public void importState(CacheState state) {
        if (state == null) {
            return;
        }
        int loaded = pageCache.importEntries(state.pageCache())
                + extractionCache.importEntries(state.extractionCache())
                + domainMap.importEntries(state.domainMap())
                + queryCache.importEntries(state.queryCache());
        log.info("Imported {} cache entries", loaded);
    }

    /**
     * Rough footprint based on average entry sizes per region.
     */
    public MemoryEstimate estimateMemory() {
        long bytes = pageCache.size() * PAGE_BYTES
                + extractionCache.size() * EXTRACTION_BYTES
                + domainMap.size() * DOMAIN_BYTES
                + queryCache.size() * QUERY_BYTES;
        String formatted = bytes < 1024 * 1024
                ? String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0)
                : String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
        return new MemoryEstimate(bytes, formatted);
    }

    private <T> Optional<T> record(Optional<T> result, String region, String key) {
        if (result.isPresent()) {
            hits.incrementAndGet();
            hitCounter.increment();
            log.debug("Cache HIT for {}: '{}'", region, key);
        } else {
            misses.incrementAndGet();
            missCounter.increment();
            log.debug("Cache MISS for {}: '{}'", region, key);
        }
        return result;
    }
}
