package org.broadinstitute.seqalign.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.seqalign.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Singleton access to the {@link org.aeonbits.owner} configuration of this library.
 *
 * A {@link Config.Sources} entry such as {@code file:${SeqAlignConfig.pathToConfig}} names its location through a
 * variable. OWNER would read an undefined variable as a literal path, so before a config type is first loaded every
 * variable that is set neither in the environment, the JVM system properties nor OWNER's own properties is pointed
 * at {@link #NO_PATH_VARIABLE_VALUE}, and that source is skipped.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory INSTANCE = new ConfigFactory();

    private static final Pattern PATH_VARIABLE = Pattern.compile("\\$\\{(.*)}");

    /**
     * Location given to path variables nobody has set.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> resolvedConfigTypes = new HashSet<>();

    public static ConfigFactory getInstance() {
        return INSTANCE;
    }

    private ConfigFactory() {}

    /**
     * @return the cached alignment defaults
     */
    public SeqAlignConfig getSeqAlignConfig() {
        return getOrCreate(SeqAlignConfig.class);
    }

    /**
     * {@link ConfigCache#getOrCreate(Class, Map[])} with the path variables of {@code configType} resolved first.
     *
     * @param configType the {@link Config} interface to load
     * @param imports extra properties used while loading
     * @return the cached instance for {@code configType}
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> configType, final Map<?, ?>... imports) {
        Utils.nonNull(configType, "configType cannot be null");
        resolvePathVariables(configType);
        return ConfigCache.getOrCreate(configType, imports);
    }

    private synchronized void resolvePathVariables(final Class<? extends Config> configType) {
        if ( resolvedConfigTypes.add(configType) ) {
            defaultUnsetPathVariables(getSourcesAnnotationPathVariables(configType));
        }
    }

    /**
     * @return the variable names used in the {@link Config.Sources} of {@code configType}, in declaration order
     */
    @VisibleForTesting
    List<String> getSourcesAnnotationPathVariables(final Class<? extends Config> configType) {
        final List<String> variables = new ArrayList<>();
        final Config.Sources sources = configType.getAnnotation(Config.Sources.class);
        if ( sources == null ) {
            return variables;
        }
        for ( final String source : sources.value() ) {
            final Matcher matcher = PATH_VARIABLE.matcher(source);
            if ( matcher.find() ) {
                variables.add(matcher.group(1));
            }
        }
        return variables;
    }

    /**
     * Sets each variable in {@code variables} that has no value yet to {@link #NO_PATH_VARIABLE_VALUE} in OWNER's
     * properties.
     */
    @VisibleForTesting
    void defaultUnsetPathVariables(final Collection<String> variables) {
        for ( final String variable : variables ) {
            final String origin = findPathVariable(variable);
            if ( origin != null ) {
                logger.debug("Config path variable {} is set in the {}", variable, origin);
            } else {
                logger.debug("Config path variable {} is not set, skipping that source", variable);
                org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    private static String findPathVariable(final String variable) {
        if ( System.getenv().containsKey(variable) ) {
            return "environment";
        }
        if ( System.getProperties().containsKey(variable) ) {
            return "system properties";
        }
        if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(variable) ) {
            return "config factory properties";
        }
        return null;
    }
}
