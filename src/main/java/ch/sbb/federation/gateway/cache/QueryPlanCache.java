package ch.sbb.federation.gateway.cache;

import ch.sbb.federation.gateway.config.GatewayProperties;
import ch.sbb.federation.gateway.planning.QueryPlan;
import ch.sbb.federation.gateway.registry.SchemaComposedEvent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import graphql.language.AstPrinter;
import graphql.language.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-memory query plan cache using Caffeine.
 *
 * <p>Keys combine the normalized query text, the operation name and a hash of the variable
 * shape (names and JSON kinds, not values). Every entry is stamped with the schema generation
 * it was planned against; a plan from another generation is never served. A stale entry is
 * evicted on its own, and the whole cache is dropped as soon as a new schema is composed.</p>
 */
@Service
public class QueryPlanCache {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanCache.class);

    private final Cache<String, CachedPlan> cache;
    private final AtomicLong latestGeneration = new AtomicLong();

    public QueryPlanCache(GatewayProperties properties) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(properties.getCache().getMaxSize())
            .expireAfterWrite(properties.getCache().getTtl())
            .build();
        log.info("Created query plan cache with max size: {}, TTL: {}",
            properties.getCache().getMaxSize(), properties.getCache().getTtl());
    }

    /**
     * Return the cached plan for this request or build and cache a new one.
     *
     * @param key the cache key, see {@link #generateKey(Document, String, Map)}
     * @param generation the generation of the schema the caller plans against
     * @param planner builds the plan on a miss
     * @return the plan
     */
    public QueryPlan getOrPlan(String key, long generation, Supplier<QueryPlan> planner) {
        QueryPlan cached = get(key, generation);
        if (cached != null) {
            return cached;
        }
        QueryPlan plan = planner.get();
        put(key, plan);
        return plan;
    }

    /**
     * Get a cached plan.
     *
     * @param key the cache key
     * @param generation the current schema generation
     * @return the plan, or {@code null} on a miss
     */
    public QueryPlan get(String key, long generation) {
        CachedPlan entry = cache.getIfPresent(key);
        if (entry == null) {
            log.debug("Plan cache miss for key: {}", key);
            return null;
        }
        if (entry.generation() < generation) {
            log.debug("Evicting plan from generation {} while serving generation {}", entry.generation(), generation);
            cache.asMap().remove(key, entry);
            return null;
        }
        if (entry.generation() > generation) {
            log.debug("Plan for key {} is from newer generation {}, not serving generation {}",
                key, entry.generation(), generation);
            return null;
        }
        log.debug("Plan cache hit for key: {}", key);
        return entry.plan();
    }

    /**
     * Cache a plan unless a plan from a newer generation is already cached under the key, or
     * a newer schema has been composed since the plan was built.
     */
    public void put(String key, QueryPlan plan) {
        long generation = plan.getGeneration();
        if (generation < latestGeneration.get()) {
            log.debug("Not caching plan from outdated generation {} for key: {}", generation, key);
            return;
        }
        CachedPlan merged = cache.asMap().merge(key, new CachedPlan(plan, generation),
            (existing, added) -> existing.generation() > added.generation() ? existing : added);
        if (merged.plan() == plan) {
            log.debug("Cached plan for key: {} (generation {})", key, generation);
        }
    }

    /**
     * Drop every cached plan.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Invalidated all cached query plans");
    }

    @EventListener
    public void onSchemaComposed(SchemaComposedEvent event) {
        log.debug("Schema generation {} composed", event.generation());
        latestGeneration.accumulateAndGet(event.generation(), Math::max);
        invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Generate the cache key of a request.
     *
     * @param document the parsed query
     * @param operationName the operation name, may be {@code null}
     * @param variables the variable values
     * @return the cache key
     */
    public String generateKey(Document document, String operationName, Map<String, Object> variables) {
        String normalized = AstPrinter.printAst(document).replaceAll("\\s+", " ").trim();
        String shapeHash = DigestUtils.md5DigestAsHex(variableShape(variables).getBytes(StandardCharsets.UTF_8));
        return String.format("federation:plan:%s:%s:%s",
            operationName != null ? operationName : "", shapeHash, normalized);
    }

    private static String variableShape(Map<String, Object> variables) {
        if (variables == null || variables.isEmpty()) {
            return "{}";
        }
        Map<String, String> shape = new TreeMap<>();
        variables.forEach((name, value) -> shape.put(name, kindOf(value)));
        return shape.toString();
    }

    private static String kindOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "list";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "string";
    }

    private record CachedPlan(QueryPlan plan, long generation) {
    }
}
