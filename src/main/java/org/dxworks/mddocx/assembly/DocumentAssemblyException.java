package org.dxworks.mddocx.assembly;

/**
 * Raised when a collaborator of the assembly pass (the Markdown parser or the serializer) fails.
 * The pass is aborted and produces no output.
 */
public class DocumentAssemblyException extends Exception {

    private final Integer sectionIndex;

    public DocumentAssemblyException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public DocumentAssemblyException(String message, Integer sectionIndex, Throwable cause) {
        super(message, cause);
        this.sectionIndex = sectionIndex;
    }

    /**
     * Index of the section being processed when the failure happened, or {@code null} when it
     * did not happen inside a section.
     */
    public Integer getSectionIndex() {
        return sectionIndex;
    }
}
