package com.weka_wrapper.unit_tests.wrapper;

import com.weka_wrapper.exception.ColumnNotFoundException;
import com.weka_wrapper.wrapper.ResolvedColumns;
import com.weka_wrapper.wrapper.TesterColumns;
import org.junit.jupiter.api.Test;
import weka.core.Attribute;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TesterColumnsTest {

    static Instances results(String... names) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String name : names) {
            attributes.add(new Attribute(name));
        }
        return new Instances("results", attributes, 0);
    }

    static Instances defaultResults() {
        return results("Key_Dataset", "Key_Run", "Key_Fold", "Key_Scheme", "Key_Scheme_options",
                "Key_Scheme_version_ID", "Percent_correct");
    }

    @Test
    void resolve_DefaultColumns_MapsToIndices() {
        // When
        ResolvedColumns resolved = TesterColumns.defaults().resolve(defaultResults());

        // Then
        assertEquals("1", resolved.datasetRange());
        assertEquals(1, resolved.runIndex());
        assertEquals(OptionalInt.of(2), resolved.foldIndex());
        assertEquals("4,5,6", resolved.resultRange());
    }

    @Test
    void resolve_FoldColumnMissingFromData_MapsToMinusOne() {
        Instances data = results("Key_Dataset", "Key_Run", "Key_Scheme", "Key_Scheme_options", "Key_Scheme_version_ID");

        ResolvedColumns resolved = TesterColumns.defaults().resolve(data);

        assertEquals(OptionalInt.of(-1), resolved.foldIndex());
        assertEquals("3,4,5", resolved.resultRange());
    }

    @Test
    void resolve_NoFoldColumnConfigured_LeavesFoldEmpty() {
        ResolvedColumns resolved = TesterColumns.defaults().withFoldColumn(null).resolve(defaultResults());

        assertTrue(resolved.foldIndex().isEmpty());
    }

    @Test
    void resolve_MissingRunColumn_NamesIt() {
        TesterColumns columns = TesterColumns.defaults().withRunColumn("Key_Repetition");

        ColumnNotFoundException ex = assertThrows(ColumnNotFoundException.class, () -> columns.resolve(defaultResults()));

        assertEquals("Key_Repetition", ex.getColumnName());
        assertEquals("Run column not found: Key_Repetition", ex.getMessage());
    }

    @Test
    void resolve_MissingResultColumn_NamesIt() {
        TesterColumns columns = TesterColumns.defaults().withResultColumns(List.of("Key_Scheme", "Key_Missing"));

        ColumnNotFoundException ex = assertThrows(ColumnNotFoundException.class, () -> columns.resolve(defaultResults()));

        assertEquals("Key_Missing", ex.getColumnName());
    }

    @Test
    void create_EmptyDatasetColumns_Fails() {
        assertThrows(IllegalArgumentException.class, () -> TesterColumns.defaults().withDatasetColumns(List.of()));
        assertThrows(NullPointerException.class, () -> TesterColumns.defaults().withRunColumn(null));
    }
}
