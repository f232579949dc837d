package io.sd.crmindex.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EntityNormalizer normalizer = new EntityNormalizer();

    @Test
    void contact_shouldJoinTextPropertiesInDeclaredOrder() throws Exception {
        // Given - propriedades fora de ordem, com espaços e um valor em branco
        JsonNode raw = mapper.readTree("""
                {"id": "101", "properties": {
                    "email": " ana@acme.io ", "lastname": "Silva", "firstname": "Ana",
                    "jobtitle": "  ", "hs_lead_status": "NEW", "phone": null }}
                """);

        // When
        Entity e = normalizer.normalize(raw, EntityType.CONTACT);

        // Then
        assertThat(e.id()).isEqualTo("101");
        assertThat(e.type()).isEqualTo(EntityType.CONTACT);
        assertThat(e.text()).isEqualTo("Ana Silva ana@acme.io");
        assertThat(e.properties())
                .containsEntry("hs_lead_status", "NEW")
                .doesNotContainKey("phone");
    }

    @Test
    void deal_shouldUseDealProperties() throws Exception {
        JsonNode raw = mapper.readTree("""
                {"id": 7, "properties": {"dealname": "Renovação", "amount": 1500, "dealstage": "closedwon"}}
                """);

        Entity e = normalizer.normalize(raw, EntityType.DEAL);

        assertThat(e.id()).isEqualTo("7");
        assertThat(e.text()).isEqualTo("Renovação closedwon 1500");
        assertThat(e.properties()).containsEntry("amount", "1500");
    }

    @Test
    void recordWithoutTextProperties_shouldHaveEmptyText() throws Exception {
        JsonNode raw = mapper.readTree("{\"id\": \"c-1\", \"properties\": {\"hs_object_id\": \"c-1\"}}");

        Entity e = normalizer.normalize(raw, EntityType.COMPANY);

        assertThat(e.text()).isEmpty();
        assertThat(e.hasText()).isFalse();
    }

    @Test
    void recordWithoutProperties_shouldStillNormalize() throws Exception {
        Entity e = normalizer.normalize(mapper.readTree("{\"id\": \"9\"}"), EntityType.COMPANY);

        assertThat(e.properties()).isEmpty();
        assertThat(e.text()).isEmpty();
    }

    @Test
    void missingOrBlankId_shouldBeMalformed() throws Exception {
        assertThatThrownBy(() -> normalizer.normalize(
                mapper.readTree("{\"properties\": {\"name\": \"Acme\"}}"), EntityType.COMPANY))
                .isInstanceOf(MalformedRecordException.class);

        assertThatThrownBy(() -> normalizer.normalize(
                mapper.readTree("{\"id\": \"  \"}"), EntityType.COMPANY))
                .isInstanceOf(MalformedRecordException.class);

        assertThatThrownBy(() -> normalizer.normalize(
                mapper.readTree("{\"id\": {\"nested\": 1}}"), EntityType.COMPANY))
                .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void nonObjectRecord_shouldBeMalformed() throws Exception {
        assertThatThrownBy(() -> normalizer.normalize(mapper.readTree("[1, 2]"), EntityType.DEAL))
                .isInstanceOf(MalformedRecordException.class);
        assertThatThrownBy(() -> normalizer.normalize(null, EntityType.DEAL))
                .isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void normalize_shouldBeDeterministic() throws Exception {
        JsonNode raw = mapper.readTree("{\"id\": \"1\", \"properties\": {\"name\": \"Acme\", \"city\": \"Porto\"}}");

        assertThat(normalizer.normalize(raw, EntityType.COMPANY))
                .isEqualTo(normalizer.normalize(raw, EntityType.COMPANY));
    }
}
