package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A non-fatal finding reported during an assembly pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagnostic {

    public enum Severity { WARNING }

    public final Severity severity;
    public final String code;
    public final String message;
    public final Integer sectionIndex;

    public Diagnostic(Severity severity, String code, String message, Integer sectionIndex) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.sectionIndex = sectionIndex;
    }

    public static Diagnostic warning(String code, String message, Integer sectionIndex) {
        return new Diagnostic(Severity.WARNING, code, message, sectionIndex);
    }

    @Override
    public String toString() {
        return severity + " " + code + (sectionIndex != null ? " [section " + sectionIndex + "]" : "") + ": " + message;
    }
}
