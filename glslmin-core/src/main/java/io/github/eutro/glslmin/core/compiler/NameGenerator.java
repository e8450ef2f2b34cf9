package io.github.eutro.glslmin.core.compiler;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Generates short, unique identifiers and remembers what they stand for.
 * <p>
 * Names are enumerated {@code a..zA..Z}, then {@code ba}, {@code ca} and so on, with digits
 * allowed after the first character.
 */
public class NameGenerator implements Cloneable {
    private static final String LEADING_CHARACTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String TRAILING_CHARACTERS = LEADING_CHARACTERS + "1234567890";

    private Map<String, String> renameMap = new HashMap<>();
    private Set<String> usedKeys = new HashSet<>();
    private int nextNameIndex = 0;
    private int nextDefinitionIndex = 0;

    /**
     * Get the nth short name.
     *
     * @param index The index.
     * @return The name.
     */
    public static String getShortName(int index) {
        StringBuilder sb = new StringBuilder();
        sb.append(LEADING_CHARACTERS.charAt(index % LEADING_CHARACTERS.length()));
        index /= LEADING_CHARACTERS.length();
        while (index > 0) {
            index -= 1;
            sb.append(TRAILING_CHARACTERS.charAt(index % TRAILING_CHARACTERS.length()));
            index /= TRAILING_CHARACTERS.length();
        }
        return sb.toString();
    }

    /**
     * Get the nth short name for a preprocessor definition, which is prefixed to avoid clashing with variables.
     *
     * @param index The index.
     * @return The name.
     */
    public static String getShortDef(int index) {
        return "_" + getShortName(index);
    }

    /**
     * Get the next unused short definition name.
     *
     * @return The name.
     */
    public String getNextShortDefinition() {
        return getShortDef(nextDefinitionIndex++);
    }

    /**
     * Get a short name for a symbol, making one if it has none yet.
     *
     * @param symbol The original name.
     * @return The short name.
     */
    public String shortenSymbol(String symbol) {
        String shortName = renameMap.get(symbol);
        if (shortName != null) return shortName;
        do {
            shortName = getShortName(nextNameIndex++);
        } while (usedKeys.contains(shortName));
        renameMap.put(symbol, shortName);
        usedKeys.add(shortName);
        return shortName;
    }

    /**
     * Get the short name of a symbol, or the symbol itself if it was never shortened.
     *
     * @param symbol The original name.
     * @return The name to use.
     */
    public String getShortSymbol(String symbol) {
        return renameMap.getOrDefault(symbol, symbol);
    }

    /**
     * Prevent a name from being generated.
     *
     * @param name The name.
     */
    public void reserve(String name) {
        usedKeys.add(name);
    }

    public int getNextNameIndex() {
        return nextNameIndex;
    }

    public void setNextNameIndex(int nextNameIndex) {
        this.nextNameIndex = nextNameIndex;
    }

    /**
     * Copy this generator; the copy continues where this one is and the two evolve independently.
     *
     * @return The copy.
     */
    @Override
    public NameGenerator clone() {
        try {
            NameGenerator clone = (NameGenerator) super.clone();
            clone.renameMap = new HashMap<>(renameMap);
            clone.usedKeys = new HashSet<>(usedKeys);
            return clone;
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }
}
