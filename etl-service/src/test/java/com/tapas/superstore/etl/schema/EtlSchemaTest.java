package com.tapas.superstore.etl.schema;

import com.tapas.superstore.etl.support.SalesRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EtlSchemaTest {

    private final EtlSchema schema = SalesRecords.superstoreSchema();

    @Test
    @DisplayName("Bundled schema declares the four entities, three relationships and twelve features")
    void bundledSchemaShape() {
        assertEquals(20, schema.fields().size());
        assertEquals(List.of("Customers", "Products", "Orders", "OrderDetails"),
                schema.entities().stream().map(EntityDefinition::name).toList());
        assertEquals(3, schema.relationships().size());
        assertEquals("OrderDetails", schema.target().entity());
        assertEquals(2, schema.target().maxDepth());
        assertEquals(12, schema.features().size());
        assertTrue(schema.entity("OrderDetails").hasSyntheticIndex());
        assertEquals(DedupStrategy.FULL_ROW, schema.entity("Orders").dedup());
    }

    @Test
    void keyFieldsCoverIndexesAndForeignKeys() {
        assertEquals(
                Set.of("Customer ID", "Product ID", "Order ID"),
                schema.keyFields());
    }

    @Test
    void rejectsRelationshipToUnknownEntity() {
        var relationships = new ArrayList<>(schema.relationships());
        relationships.add(new RelationshipDefinition("Regions", "Region", "Customers", "Region"));
        EtlSchema broken = new EtlSchema(schema.name(), schema.dateFormats(), schema.fields(),
                schema.entities(), relationships, schema.target(), schema.features());

        var ex = assertThrows(IllegalStateException.class, broken::validate);
        assertTrue(ex.getMessage().contains("unknown entity"));
    }

    @Test
    void rejectsDuplicateFeatureOutputNames() {
        var features = new ArrayList<>(schema.features());
        features.add(new FeatureSelection("Orders.MIN(OrderDetails.Sales)", "Order_Total_Sales"));
        EtlSchema broken = new EtlSchema(schema.name(), schema.dateFormats(), schema.fields(),
                schema.entities(), schema.relationships(), schema.target(), features);

        assertThrows(IllegalStateException.class, broken::validate);
    }

    @Test
    void rejectsEntityProjectingUnknownField() {
        var entities = new ArrayList<>(schema.entities());
        entities.set(1, new EntityDefinition("Products", "Product ID",
                List.of("Product ID", "Brand"), DedupStrategy.INDEX, null));
        EtlSchema broken = new EtlSchema(schema.name(), schema.dateFormats(), schema.fields(),
                entities, schema.relationships(), schema.target(), schema.features());

        var ex = assertThrows(IllegalStateException.class, broken::validate);
        assertTrue(ex.getMessage().contains("Brand"));
    }

    @Test
    void rejectsZeroDepth() {
        EtlSchema broken = new EtlSchema(schema.name(), schema.dateFormats(), schema.fields(),
                schema.entities(), schema.relationships(), new TargetDefinition("OrderDetails", 0),
                schema.features());

        assertThrows(IllegalStateException.class, broken::validate);
    }
}
