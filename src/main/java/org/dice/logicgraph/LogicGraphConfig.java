package org.dice.logicgraph;

import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.NumberUtils;
import org.dice.logicgraph.parsing.RecursiveDescentParser;
import org.dice.logicgraph.parsing.WhitespaceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for parsing expressions and building graphs. Instances are immutable, the {@code with*}
 * methods return modified copies.
 */
public final class LogicGraphConfig {

    private static final Logger Log = LoggerFactory.getLogger( LogicGraphConfig.class );

    public static final String RESOURCE_NAME = "logicgraph.properties";

    // how whitespace in an expression is treated, one of WhitespaceMode
    public static final String WHITESPACE = "logicgraph.whitespace";
    // only accept A, A.B and !(A.B)
    public static final String STRICT_GRAMMAR = "logicgraph.strictGrammar";
    // share one node between A.B and B.A
    public static final String COMMUTATIVE = "logicgraph.commutative";
    // deepest NAND nesting accepted by the parser
    public static final String MAX_DEPTH = "logicgraph.maxDepth";

    private static final LogicGraphConfig DEFAULTS =
            new LogicGraphConfig(WhitespaceMode.TRIM, false, false, RecursiveDescentParser.DEFAULT_MAX_DEPTH);

    private final WhitespaceMode whitespaceMode;
    private final boolean strictGrammar;
    private final boolean commutative;
    private final int maxDepth;

    private LogicGraphConfig(WhitespaceMode whitespaceMode, boolean strictGrammar, boolean commutative, int maxDepth) {
        this.whitespaceMode = Preconditions.checkNotNull(whitespaceMode);
        Preconditions.checkArgument(maxDepth > 0, "%s must be positive, was %s", MAX_DEPTH, maxDepth);
        this.strictGrammar = strictGrammar;
        this.commutative = commutative;
        this.maxDepth = maxDepth;
    }

    public static LogicGraphConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, using the defaults when it is absent or unreadable.
     */
    public static LogicGraphConfig load() {
        InputStream stream = LogicGraphConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME);
        if(stream == null){
            return DEFAULTS;
        }

        Properties properties = new Properties();
        try {
            try {
                properties.load(stream);
            } finally {
                stream.close();
            }
        } catch (IOException e) {
            Log.warn(String.format("Failed to read %s, using default settings", RESOURCE_NAME), e);
            return DEFAULTS;
        }
        return fromProperties(properties);
    }

    /**
     * Missing keys keep their default value. An unknown whitespace mode or a bad depth is logged and ignored.
     */
    public static LogicGraphConfig fromProperties(Properties properties) {
        Preconditions.checkNotNull(properties);

        WhitespaceMode whitespaceMode = DEFAULTS.whitespaceMode;
        String sWhitespace = properties.getProperty(WHITESPACE);
        if(false == StringUtils.isBlank(sWhitespace)){
            try {
                whitespaceMode = WhitespaceMode.valueOf(sWhitespace.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                Log.error(String.format("%s has unknown value '%s', expected one of TRIM, IGNORE, REJECT. Using %s",
                        WHITESPACE, sWhitespace, whitespaceMode));
            }
        }

        boolean strictGrammar = readBoolean(properties, STRICT_GRAMMAR, DEFAULTS.strictGrammar);
        boolean commutative = readBoolean(properties, COMMUTATIVE, DEFAULTS.commutative);

        int maxDepth = DEFAULTS.maxDepth;
        String sMaxDepth = properties.getProperty(MAX_DEPTH);
        if(false == StringUtils.isBlank(sMaxDepth)){
            int parsed = NumberUtils.toInt(sMaxDepth.trim(), -1);
            if(parsed > 0){
                maxDepth = parsed;
            }
            else{
                Log.error(String.format("%s has invalid value '%s', expected a positive integer. Using %d",
                        MAX_DEPTH, sMaxDepth, maxDepth));
            }
        }
        return new LogicGraphConfig(whitespaceMode, strictGrammar, commutative, maxDepth);
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue){
        String value = properties.getProperty(key);
        if(StringUtils.isBlank(value)){
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public WhitespaceMode getWhitespaceMode() {
        return whitespaceMode;
    }

    public boolean isStrictGrammar() {
        return strictGrammar;
    }

    public boolean isCommutative() {
        return commutative;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public LogicGraphConfig withWhitespaceMode(WhitespaceMode whitespaceMode) {
        return new LogicGraphConfig(whitespaceMode, strictGrammar, commutative, maxDepth);
    }

    public LogicGraphConfig withStrictGrammar(boolean strictGrammar) {
        return new LogicGraphConfig(whitespaceMode, strictGrammar, commutative, maxDepth);
    }

    public LogicGraphConfig withCommutative(boolean commutative) {
        return new LogicGraphConfig(whitespaceMode, strictGrammar, commutative, maxDepth);
    }

    public LogicGraphConfig withMaxDepth(int maxDepth) {
        return new LogicGraphConfig(whitespaceMode, strictGrammar, commutative, maxDepth);
    }

    @Override
    public String toString() {
        return String.format("whitespace=%s, strictGrammar=%s, commutative=%s, maxDepth=%d",
                whitespaceMode, strictGrammar, commutative, maxDepth);
    }
}
