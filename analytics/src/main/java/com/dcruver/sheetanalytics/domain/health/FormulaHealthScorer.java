package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.Level;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.springframework.stereotype.Component;

@Component
public class FormulaHealthScorer {

    public FormulaHealth score(RawSnapshot snapshot) {
        int formulaColumns = (int) snapshot.getColumns().stream()
            .filter(ColumnDescriptor::isFormulaColumn)
            .count();

        return FormulaHealth.builder()
            .formulaColumnCount(formulaColumns)
            .hasFormulas(formulaColumns > 0)
            .complexity(Level.classify(formulaColumns, 2, 5))
            .build();
    }
}
