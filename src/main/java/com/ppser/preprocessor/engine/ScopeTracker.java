package com.ppser.preprocessor.engine;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.exception.ErrorKind;

/**
 * Tracks the enclosing MODULE or PROGRAM unit. Units do not nest.
 */
public class ScopeTracker {

    private static final Pattern UNIT_OPEN = Pattern.compile(
            "^[ \\t]*(module|program)[ \\t]+([a-z][a-z0-9_]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNIT_END = Pattern.compile(
            "^[ \\t]*end[ \\t]*(module|program)\\b(?![ \\t]*=)(?:[ \\t]+([a-z][a-z0-9_]*))?", Pattern.CASE_INSENSITIVE);

    // "module procedure foo" and friends are interface items, not units
    private static final Set<String> NOT_UNIT_NAMES = Set.of("PROCEDURE", "SUBROUTINE", "FUNCTION");

    private String openUnit;
    private String openKind;

    /**
     * Inspects one line and updates the open unit.
     *
     * @return true if the line opened or closed a unit
     */
    public boolean track(String line) {
        Matcher end = UNIT_END.matcher(line);
        if (end.find()) {
            close(end.group(1), end.group(2));
            return true;
        }

        Matcher open = UNIT_OPEN.matcher(line);
        if (open.find() && !NOT_UNIT_NAMES.contains(open.group(2).toUpperCase(Locale.ROOT))) {
            open(open.group(1), open.group(2));
            return true;
        }
        return false;
    }

    public void open(String kind, String name) {
        if (openUnit != null) {
            throw structural("Unexpected " + kind + " statement; " + openKind + " " + openUnit + " is still open");
        }
        openKind = kind.toLowerCase(Locale.ROOT);
        openUnit = name;
    }

    /**
     * Closes the open unit; a null name closes whatever is open.
     */
    public void close(String kind, String name) {
        String lowerKind = kind.toLowerCase(Locale.ROOT);
        if (openUnit == null) {
            throw structural("Unexpected \"end " + lowerKind + "\" statement");
        }
        if (name != null && !openUnit.equalsIgnoreCase(name)) {
            throw structural("Was expecting \"end " + openKind + " " + openUnit + "\"");
        }
        openUnit = null;
        openKind = null;
    }

    public void verifyClosed() {
        if (openUnit != null) {
            throw structural("Unterminated module or program unit encountered: " + openKind + " " + openUnit);
        }
    }

    public Optional<String> getOpenUnit() {
        return Optional.ofNullable(openUnit);
    }

    private static DirectiveException structural(String message) {
        return new DirectiveException(ErrorKind.STRUCTURAL, null, message);
    }
}
