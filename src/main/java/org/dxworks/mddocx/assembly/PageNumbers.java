package org.dxworks.mddocx.assembly;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.mddocx.config.PageNumberFormat;
import org.dxworks.mddocx.config.PageNumberSeparator;
import org.dxworks.mddocx.config.PageNumbering;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PageNumbers {
    public final Integer start;
    public final PageNumberFormat formatType;
    public final PageNumberSeparator separator;

    public PageNumbers(Integer start, PageNumberFormat formatType, PageNumberSeparator separator) {
        this.start = start;
        this.formatType = formatType;
        this.separator = separator;
    }

    /**
     * Section page-number properties, or {@code null} when the numbering sets none of them.
     */
    static PageNumbers from(PageNumbering numbering) {
        if (numbering == null
                || (numbering.start == null && numbering.formatType == null && numbering.separator == null)) {
            return null;
        }
        return new PageNumbers(numbering.start, numbering.formatType, numbering.separator);
    }
}
