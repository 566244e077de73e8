package org.openfoodfacts.robotoff.dto;

import lombok.Builder;
import org.openfoodfacts.robotoff.enums.MatchType;

import java.util.Objects;

@Builder
public record ProductRequestDTO(String queryText,
                                MatchType matchType,
                                Integer size,
                                Integer page) {

    public Integer getValidatedSize(Integer defaultSize) {
        if (Objects.isNull(this.size)) {
            return defaultSize;
        }
        return this.size;
    }

    public Integer getValidatedPage(Integer defaultPage) {
        if (Objects.isNull(this.page)) {
            return defaultPage;
        }
        return this.page;
    }

    public MatchType getValidatedMatchType() {
        return Objects.requireNonNullElse(this.matchType, MatchType.ALL);
    }

    /**
     * Offset of the first hit, computed on a long so that no page number can overflow it.
     */
    public long from(Integer defaultSize, Integer defaultPage) {
        return (long) getValidatedSize(defaultSize) * getValidatedPage(defaultPage);
    }
}
