package com.di.trialguard.contract;

import com.di.trialguard.dataset.ColumnType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataContract Tests")
class DataContractTest {

    private static ColumnContract column(String name, ColumnType type, boolean nullable) {
        return ColumnContract.builder().name(name).dtype(type).nullable(nullable).build();
    }

    private static DataContract.DataContractBuilder base(List<ColumnContract> columns) {
        return DataContract.builder().name("c").version("1.0.0").domain("DM").columns(columns);
    }

    @Test
    @DisplayName("Should produce an 8 character hash independent of column order")
    void testSchemaHash_OrderIndependent() {
        DataContract ab = base(List.of(column("A", ColumnType.STRING, false), column("B", ColumnType.INT64, true))).build();
        DataContract ba = base(List.of(column("B", ColumnType.INT64, true), column("A", ColumnType.STRING, false))).build();

        assertEquals(8, ab.getSchemaHash().length());
        assertTrue(ab.getSchemaHash().matches("[0-9a-f]{8}"));
        assertEquals(ab.getSchemaHash(), ba.getSchemaHash());
    }

    @Test
    @DisplayName("Should change the hash when a type or nullability changes")
    void testSchemaHash_Sensitive() {
        String original = base(List.of(column("A", ColumnType.STRING, false))).build().getSchemaHash();
        assertNotEquals(original, base(List.of(column("A", ColumnType.INT64, false))).build().getSchemaHash());
        assertNotEquals(original, base(List.of(column("A", ColumnType.STRING, true))).build().getSchemaHash());
    }

    @Test
    @DisplayName("Should reject duplicate column names")
    void testDuplicateColumns() {
        List<ColumnContract> columns = List.of(column("A", ColumnType.STRING, true), column("A", ColumnType.INT64, true));
        assertThrows(MalformedContractException.class, () -> base(columns).build());
    }

    @Test
    @DisplayName("Should reject blank identity fields and empty column lists")
    void testRequiredFields() {
        List<ColumnContract> columns = List.of(column("A", ColumnType.STRING, true));
        assertThrows(MalformedContractException.class, () -> base(columns).name(" ").build());
        assertThrows(MalformedContractException.class, () -> base(columns).version(null).build());
        assertThrows(MalformedContractException.class, () -> base(List.of()).build());
    }

    @Test
    @DisplayName("Should reject a foreign key on an undeclared column")
    void testForeignKeyColumnMissing() {
        List<ColumnContract> columns = List.of(column("A", ColumnType.STRING, true));
        assertThrows(MalformedContractException.class,
                () -> base(columns).foreignKeys(Map.of("B", "DM.USUBJID")).build());
    }

    @Test
    @DisplayName("Should default compatibility mode and timestamps")
    void testDefaults() {
        DataContract contract = base(List.of(column("A", ColumnType.STRING, true))).build();
        assertEquals(CompatibilityMode.BACKWARD, contract.compatibilityMode());
        assertNotNull(contract.createdAt());
        assertEquals(contract.createdAt(), contract.updatedAt());
        assertTrue(contract.primaryKey().isEmpty());
        assertTrue(contract.foreignKeys().isEmpty());
        assertEquals(List.of("A"), contract.getColumnNames());
    }
}
