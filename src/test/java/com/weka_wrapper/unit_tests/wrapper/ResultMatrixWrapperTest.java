package com.weka_wrapper.unit_tests.wrapper;

import com.weka_wrapper.exception.TypeMismatchException;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.wrapper.ResultMatrixWrapper;
import com.weka_wrapper.wrapper.TesterWrapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import weka.experiment.ResultMatrixPlainText;

import static org.junit.jupiter.api.Assertions.*;

class ResultMatrixWrapperTest {

    private WekaRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = WekaRuntime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void create_WithOptions_ConfiguresMatrix() throws Exception {
        // When
        ResultMatrixWrapper matrix = new ResultMatrixWrapper(runtime, ResultMatrixWrapper.DEFAULT_CLASSNAME, "-mean-prec", "3");

        // Then
        ResultMatrixPlainText plainText = assertInstanceOf(ResultMatrixPlainText.class, matrix.getJavaObject());
        assertEquals(3, plainText.getMeanPrec());
    }

    @Test
    void create_CsvMatrix() throws Exception {
        ResultMatrixWrapper matrix = new ResultMatrixWrapper(runtime, "weka.experiment.ResultMatrixCSV");

        assertEquals("weka.experiment.ResultMatrixCSV", matrix.getClassname());
    }

    @Test
    void create_WithTesterClass_ThrowsTypeMismatch() {
        assertThrows(TypeMismatchException.class,
                () -> new ResultMatrixWrapper(runtime, TesterWrapper.DEFAULT_CLASSNAME));
    }
}
