package com.yuzhi.dts.iac.service.diff;

import static org.assertj.core.api.Assertions.assertThat;

import com.yuzhi.dts.iac.domain.FieldType;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldComparatorTest {

    @Test
    void numericFieldsCompareByValueAcrossRepresentations() {
        assertThat(FieldComparator.equivalent(FieldType.NUMERIC, "5432", 5432)).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.NUMERIC, 30, 30.0)).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.NUMERIC, 30, 31)).isFalse();
        assertThat(FieldComparator.equivalent(FieldType.NUMERIC, null, 5432)).isFalse();
    }

    @Test
    void unorderedListsIgnoreOrder() {
        assertThat(FieldComparator.equivalent(FieldType.UNORDERED_LIST, List.of("b", "a"), List.of("a", "b"))).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.UNORDERED_LIST, List.of("a"), List.of("a", "b"))).isFalse();
        assertThat(FieldComparator.equivalent(FieldType.UNORDERED_LIST, null, List.of())).isTrue();
    }

    @Test
    void orderedListsRespectOrder() {
        assertThat(FieldComparator.equivalent(FieldType.ORDERED_LIST, List.of("a", "b"), List.of("a", "b"))).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.ORDERED_LIST, List.of("b", "a"), List.of("a", "b"))).isFalse();
    }

    @Test
    void scalarsNormalizeBooleansAndWhitespace() {
        assertThat(FieldComparator.equivalent(FieldType.SCALAR, true, "True")).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.SCALAR, " db.internal ", "db.internal")).isTrue();
        assertThat(FieldComparator.equivalent(FieldType.SCALAR, "a", "b")).isFalse();
        assertThat(FieldComparator.equivalent(FieldType.SCALAR, null, null)).isTrue();
    }

    @Test
    void displaySortsUnorderedLists() {
        assertThat(FieldComparator.display(FieldType.UNORDERED_LIST, List.of("see_looks", "access_data")))
            .isEqualTo(List.of("access_data", "see_looks"));
        assertThat(FieldComparator.display(FieldType.SCALAR, null)).isNull();
    }
}
