package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.Level;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FormulaHealth {
    private final int formulaColumnCount;
    private final boolean hasFormulas;
    private final Level complexity;
}
