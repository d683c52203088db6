package com.abba.pillnow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PillConfig {

    private int count;
    private String label;

    public static PillConfig empty() {
        return new PillConfig(0, null);
    }

    public PillConfig copy() {
        return new PillConfig(count, label);
    }

    public PillConfig mergedWith(PillConfig update) {
        if (update == null) {
            return copy();
        }
        String mergedLabel = update.getLabel() == null || update.getLabel().isBlank() ? label : update.getLabel();
        return new PillConfig(update.getCount(), mergedLabel);
    }
}
