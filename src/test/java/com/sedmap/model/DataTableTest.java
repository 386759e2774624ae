package com.sedmap.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sedmap.exception.ColumnLookupException;
import com.sedmap.exception.ConfigurationException;
import com.sedmap.exception.ShapeMismatchException;
import com.sedmap.exception.UnsupportedEngineException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class DataTableTest {

    private DataTable table() {
        return new DataTable(Arrays.asList(
                Column.ofIntegers("ID", new long[]{0, 3, 5}),
                Column.withErrors("u", new double[]{20, 21, 22}, new double[]{0.1, 0.2, 0.3}, "mag"),
                Column.of("zs", new double[]{0.1, 0.1, 0.1})), "ID");
    }

    @Test
    void keepsInsertionOrder() {
        assertThat(table().getColumnNames()).containsExactly("ID", "u", "zs");
        assertThat(table().getRowCount()).isEqualTo(3);
    }

    @Test
    void idsAreIntegerPositions() {
        assertThat(table().ids()).containsExactly(0, 3, 5);
        assertThat(table().column("ID").integer).isTrue();
    }

    @Test
    void unknownColumnListsAvailableOnes() {
        assertThatThrownBy(() -> table().column("mass"))
                .isInstanceOf(ColumnLookupException.class)
                .hasMessageContaining("mass")
                .hasMessageContaining("[ID, u, zs]");
    }

    @Test
    void rejectsColumnsOfDifferentLengths() {
        assertThatThrownBy(() -> new DataTable(Arrays.asList(
                Column.of("a", new double[]{1, 2}), Column.of("b", new double[]{1})), null))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void rejectsDuplicateNamesAndMissingIdColumn() {
        assertThatThrownBy(() -> new DataTable(Arrays.asList(
                Column.of("a", new double[]{1}), Column.of("a", new double[]{2})), null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new DataTable(Arrays.asList(Column.of("a", new double[]{1})), "ID"))
                .isInstanceOf(ColumnLookupException.class);
    }

    @Test
    void errorsMustMatchValues() {
        assertThatThrownBy(() -> Column.withErrors("u", new double[]{1, 2}, new double[]{1}, "mag"))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void engineLookupIsCaseInsensitive() {
        assertThat(Engine.fromName(" LePhare ")).isEqualTo(Engine.LEPHARE);
        assertThat(Engine.fromName("cigale")).isEqualTo(Engine.CIGALE);
        assertThatThrownBy(() -> Engine.fromName("eazy"))
                .isInstanceOf(UnsupportedEngineException.class)
                .hasMessageContaining("eazy");
        assertThat(Engine.LEPHARE.errorColumnName("u")).isEqualTo("e_u");
        assertThat(Engine.CIGALE.errorColumnName("u")).isEqualTo("u_err");
    }

    @Test
    void identifiersMustBePixelPositions() {
        for (double bad : new double[]{Double.NaN, 1.5, -1, 3e9}) {
            DataTable t = new DataTable(Arrays.asList(
                    new Column("ID", new double[]{0, bad}, null, null, true)), "ID");
            assertThatThrownBy(t::ids)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Row 1");
        }
        assertThatThrownBy(() -> Column.ofIdentifiers("id", new double[]{2, Double.NaN}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Row 1");
        assertThat(Column.ofIdentifiers("id", new double[]{2, 7}).integer).isTrue();
    }
}
