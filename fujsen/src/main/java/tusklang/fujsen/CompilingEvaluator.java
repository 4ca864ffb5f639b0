/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.fujsen;

import org.apache.commons.lang3.Validate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for evaluators whose host runtime separates compiling a body from running it.
 *
 * <p>Compiled forms are cached per body and parameter list in a least recently used map of
 * bounded size, so a body executed repeatedly is compiled once. Values are immutable, which
 * is why the cache lives here and not on the value.</p>
 *
 * <p>Thread-safe as long as {@link #compile} and {@link #invoke} are.</p>
 *
 * @param <C> the runtime's compiled form
 */
public abstract class CompilingEvaluator<C> implements FujsenEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(CompilingEvaluator.class);

    public static final int DEFAULT_CACHE_SIZE = 1000;

    private final int cacheSize;
    private final Map<CacheKey, C> cache;
    private long hits;
    private long misses;

    protected CompilingEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    protected CompilingEvaluator(int cacheSize) {
        Validate.isTrue(cacheSize > 0, "cacheSize must be positive: %d", cacheSize);
        this.cacheSize = cacheSize;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, C> eldest) {
                return size() > CompilingEvaluator.this.cacheSize;
            }
        };
    }

    /**
     * Compiles a body.
     *
     * @throws EvaluationException if the body does not compile
     */
    protected abstract C compile(String body, List<String> parameterNames)
        throws EvaluationException;

    /**
     * Runs a compiled body with its bindings.
     */
    protected abstract @Nullable Object invoke(C compiled, List<String> parameterNames,
                                               Map<String, @Nullable Object> bindings)
        throws EvaluationException;

    @Override
    public final @Nullable Object evaluate(String body, List<String> parameterNames,
                                           Map<String, @Nullable Object> bindings)
        throws EvaluationException {
        return invoke(compiled(body, parameterNames), parameterNames, bindings);
    }

    private C compiled(String body, List<String> parameterNames) throws EvaluationException {
        CacheKey key = new CacheKey(body, List.copyOf(parameterNames));
        synchronized (cache) {
            C c = cache.get(key);
            if (c != null) {
                hits++;
                return c;
            }
            misses++;
        }
        // compiled outside the lock, concurrent misses may compile the same body twice
        C c = compile(body, parameterNames);
        synchronized (cache) {
            cache.put(key, c);
        }
        logger.debug("Compiled FUJSEN body of {} chars", body.length());
        return c;
    }

    public int cachedCount() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public long getHits() {
        synchronized (cache) {
            return hits;
        }
    }

    public long getMisses() {
        synchronized (cache) {
            return misses;
        }
    }

    public void clearCache() {
        synchronized (cache) {
            cache.clear();
        }
    }

    private record CacheKey(String body, List<String> parameterNames) {
    }
}
