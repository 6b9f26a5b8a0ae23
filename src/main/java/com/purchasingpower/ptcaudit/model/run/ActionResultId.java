package com.purchasingpower.ptcaudit.model.run;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of {@link ActionResultEntity}: a result id and its version.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionResultId implements Serializable {
    private String resultId;
    private Integer version;
}
