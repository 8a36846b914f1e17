package com.eainde.verity.knowledge;

import com.eainde.verity.model.FindingCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ActionTemplateTableTest {

    private final ActionTemplateTable table = new ActionTemplateTable();

    @Test
    @DisplayName("specific categories get their own template")
    void specific() {
        assertThat(table.templateFor(FindingCategory.CERTIFICATE_EXPIRED).instruction()).contains("renewed certification");
        assertThat(table.templateFor(FindingCategory.SOURCE_MISMATCH).verificationMethod()).contains("GLEIF");
    }

    @Test
    @DisplayName("unmapped or unknown categories get the generic template")
    void generic() {
        assertThat(table.templateFor(FindingCategory.DUPLICATE_REFERENCE)).isSameAs(ActionTemplateTable.GENERIC);
        assertThat(table.templateFor(null)).isSameAs(ActionTemplateTable.GENERIC);
    }
}
