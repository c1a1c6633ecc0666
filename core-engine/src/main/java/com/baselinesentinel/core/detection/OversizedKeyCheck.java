package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.KeyUsage;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.KeyspaceInspector;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Cache keys whose memory usage exceeds a size limit.
 *
 * <p>
 * Unlike the windowed checks this one inspects the store as it is now; the
 * window pair is ignored. The domain's source must be a
 * {@link KeyspaceInspector}.
 * </p>
 *
 * @since 1.1.0
 */
public class OversizedKeyCheck implements AnomalyCheck {

    private static final Logger LOG = LoggerFactory.getLogger(OversizedKeyCheck.class);

    static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final String name;
    private final double limitMb;

    public OversizedKeyCheck(CheckRule rule) {
        Objects.requireNonNull(rule, "CheckRule must not be null");
        this.name = Objects.requireNonNull(rule.getName(), "Check name must not be null");
        this.limitMb = Objects.requireNonNull(rule.getThreshold(),
                "Threshold must not be null for bigkeys check '" + name + "'");
    }

    @Override
    public void verifySource(MetricSource source) {
        if (!(source instanceof KeyspaceInspector)) {
            throw new IllegalArgumentException("Check '" + name + "' needs a source that can inspect keys, got "
                    + source.getClass().getSimpleName());
        }
    }

    @Override
    public List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException {
        verifySource(source);
        long limitBytes = (long) (limitMb * BYTES_PER_MB);
        List<KeyUsage> keys = new ArrayList<>(((KeyspaceInspector) source).findKeysLargerThan(limitBytes));
        keys.sort(Comparator.comparingLong(KeyUsage::getBytes).reversed());

        List<AnomalyRecord> records = new ArrayList<>(keys.size());
        for (KeyUsage key : keys) {
            if (!(key.getBytes() / BYTES_PER_MB > limitMb)) {
                continue;
            }
            double sizeMb = BaselineComparator.round2(key.getBytes() / BYTES_PER_MB);
            LOG.debug("Check [{}]: key {} on {} holds {} MB", name, key.getKey(), key.getNode(), sizeMb);
            records.add(AnomalyRecord.builder()
                    .domain(domain)
                    .check(name)
                    .type(AnomalyType.OVERSIZED_KEY)
                    .entity(EntityKey.of(key.getNode(), key.getKey()))
                    .metric(key.getType())
                    .currentValue(sizeMb)
                    .threshold(limitMb)
                    .magnitude(sizeMb)
                    .severityNote(String.format(Locale.ROOT, "%s key holds %.2f MB (limit %.2f MB)",
                            key.getType(), sizeMb, limitMb))
                    .build());
        }
        return records;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "OversizedKeyCheck{name='" + name + "', limitMb=" + limitMb + '}';
    }
}
