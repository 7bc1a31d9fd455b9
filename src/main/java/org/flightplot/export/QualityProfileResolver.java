package org.flightplot.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Maps quality tier names to {@link QualityProfile}s and concrete sampling parameters.
 * <p>
 * Tiers are read from the {@code flightplot.export} configuration section:
 * <pre>
 * tier-order = [fastest, fast-preview, standard, high]
 * tiers {
 *   fastest {
 *     label = "Fastest"
 *     width = 240, height = 160, scale = 0.3
 *     frame-duration = 500ms
 *     max-frames = 10
 *     palette-colors = 16
 *     buckets = [ { max-count = 10, stride = 1, cap = 10 }, ..., { stride = 0, cap = 8 } ]
 *   }
 *   standard { ..., stride-threshold = 100 }
 * }
 * </pre>
 * A tier declares either {@code buckets} or {@code stride-threshold}. Omitting
 * {@code palette-colors} selects full-color encoding. A bucket without {@code max-count}
 * is open-ended.
 * <p>
 * Tier definitions are validated when resolved, so a broken tier only fails the
 * requests that select it.
 */
public class QualityProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(QualityProfileResolver.class);

    private static final String CONFIG_PATH = "flightplot.export";

    private final Config tiersConfig;
    private final List<String> tierOrder;

    /**
     * Creates a resolver over an export configuration section.
     *
     * @param exportConfig the {@code flightplot.export} section.
     */
    public QualityProfileResolver(Config exportConfig) {
        this.tiersConfig = exportConfig.getConfig("tiers");
        this.tierOrder = exportConfig.hasPath("tier-order")
            ? List.copyOf(exportConfig.getStringList("tier-order"))
            : List.copyOf(tiersConfig.root().keySet());
    }

    /**
     * Creates a resolver over the built-in tiers from {@code reference.conf}.
     *
     * @return resolver with the default tier table.
     */
    public static QualityProfileResolver defaults() {
        return fromApplicationConfig(ConfigFactory.defaultReference());
    }

    /**
     * Creates a resolver from a full application configuration.
     *
     * @param config the resolved application configuration.
     * @return resolver over its {@code flightplot.export} section.
     */
    public static QualityProfileResolver fromApplicationConfig(Config config) {
        return new QualityProfileResolver(config.getConfig(CONFIG_PATH));
    }

    /**
     * Returns the canonical names of all configured tiers, in display order.
     *
     * @return tier names.
     */
    public List<String> tierNames() {
        return tierOrder;
    }

    /**
     * Resolves a tier and computes its sampling parameters for a source size.
     *
     * @param tierName   tier name or label, matched case-insensitively.
     * @param totalCount number of source frames.
     * @return the profile with stride and cap.
     * @throws ConfigurationException if the tier is unknown or its definition is invalid.
     */
    public ResolvedProfile resolve(String tierName, int totalCount) throws ConfigurationException {
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total frame count must not be negative: " + totalCount);
        }
        QualityProfile profile = profile(tierName);
        FrameStepPolicy policy = profile.frameStepPolicy();

        int stride = policy.strideFor(totalCount);
        OptionalInt cap = policy.capFor(totalCount);
        if (profile.maxFrameBudget().isPresent()) {
            int budget = profile.maxFrameBudget().getAsInt();
            cap = OptionalInt.of(cap.isPresent() ? Math.min(cap.getAsInt(), budget) : budget);
        }

        log.debug("Resolved tier '{}' for {} frames: stride={}, cap={}",
            profile.tier(), totalCount, stride, cap.isPresent() ? cap.getAsInt() : "none");
        return new ResolvedProfile(profile, totalCount, stride, cap);
    }

    /**
     * Looks up and validates the profile of a tier.
     *
     * @param tierName tier name or label, matched case-insensitively.
     * @return the tier's profile.
     * @throws ConfigurationException if the tier is unknown or its definition is invalid.
     */
    public QualityProfile profile(String tierName) throws ConfigurationException {
        String tier = canonicalName(tierName);
        try {
            return parseProfile(tier, tiersConfig.getConfig(tier));
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid definition of quality tier '" + tier + "': " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid definition of quality tier '" + tier + "': " + e.getMessage(), e);
        }
    }

    private String canonicalName(String tierName) throws ConfigurationException {
        if (tierName == null || tierName.isBlank()) {
            throw new ConfigurationException("No quality tier given. Known tiers: " + tierOrder);
        }
        String normalized = normalize(tierName);
        for (String tier : tierOrder) {
            if (normalize(tier).equals(normalized)) {
                return tier;
            }
            String labelPath = tier + ".label";
            if (tiersConfig.hasPath(labelPath) && normalize(tiersConfig.getString(labelPath)).equals(normalized)) {
                return tier;
            }
        }
        throw new ConfigurationException("Unknown quality tier '" + tierName + "'. Known tiers: " + tierOrder);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
    }

    private QualityProfile parseProfile(String tier, Config c) throws ConfigurationException {
        String label = c.hasPath("label") ? c.getString("label") : tier;
        int width = c.getInt("width");
        int height = c.getInt("height");
        double scale = c.getDouble("scale");
        long duration = c.getDuration("frame-duration", TimeUnit.MILLISECONDS);

        if (width < 1 || height < 1) {
            throw new ConfigurationException("Tier '" + tier + "' needs a positive size, got " + width + "x" + height);
        }
        if (scale < 0 || Double.isNaN(scale)) {
            throw new ConfigurationException("Tier '" + tier + "' needs a non-negative scale, got " + scale);
        }
        if (duration < 1) {
            throw new ConfigurationException("Tier '" + tier + "' needs a positive frame duration, got " + duration + "ms");
        }

        OptionalInt maxFrames = OptionalInt.empty();
        if (c.hasPath("max-frames")) {
            int value = c.getInt("max-frames");
            if (value < 1) {
                throw new ConfigurationException("Tier '" + tier + "' needs max-frames >= 1, got " + value);
            }
            maxFrames = OptionalInt.of(value);
        }

        ColorEncoding encoding = c.hasPath("palette-colors")
            ? ColorEncoding.reducedPalette(c.getInt("palette-colors"))
            : ColorEncoding.fullColor();

        return new QualityProfile(tier, label, width, height, scale, maxFrames,
            parseStepPolicy(tier, c), (int) duration, encoding);
    }

    private FrameStepPolicy parseStepPolicy(String tier, Config c) throws ConfigurationException {
        if (c.hasPath("buckets")) {
            List<FrameStepPolicy.Bucket> buckets = new ArrayList<>();
            for (Config bucket : c.getConfigList("buckets")) {
                int maxCount = bucket.hasPath("max-count") ? bucket.getInt("max-count") : Integer.MAX_VALUE;
                buckets.add(new FrameStepPolicy.Bucket(maxCount, bucket.getInt("stride"), bucket.getInt("cap")));
            }
            return new FrameStepPolicy.Buckets(buckets);
        }
        if (c.hasPath("stride-threshold")) {
            return new FrameStepPolicy.Threshold(c.getInt("stride-threshold"));
        }
        throw new ConfigurationException("Tier '" + tier + "' declares neither 'buckets' nor 'stride-threshold'");
    }
}
