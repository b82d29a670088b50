package com.customer.identity.store.jdbc;

import com.customer.identity.core.model.Customer;
import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.core.model.Provider;
import com.customer.identity.store.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Column lists and row mappers for the {@code customers} and {@code customer_identities} tables.
 */
final class CustomerRows {

    static final String CUSTOMER_COLUMNS = """
            c.id, c.primary_email, c.primary_phone, c.first_name, c.last_name, c.company,
            c.is_vip, c.credit_risk_level, c.created_at, c.updated_at""";

    static final String IDENTITY_COLUMNS = """
            i.id, i.customer_id, i.provider, i.external_id, i.email, i.phone, i.metadata::text AS metadata,
            i.created_at, i.updated_at""";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private CustomerRows() {
    }

    static Customer customer(ResultSet rs) throws SQLException {
        return Customer.builder()
                .id(rs.getLong("id"))
                .primaryEmail(rs.getString("primary_email"))
                .primaryPhone(rs.getString("primary_phone"))
                .firstName(rs.getString("first_name"))
                .lastName(rs.getString("last_name"))
                .company(rs.getString("company"))
                .vip(rs.getBoolean("is_vip"))
                .creditRiskLevel(rs.getString("credit_risk_level"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    static CustomerIdentity identity(ResultSet rs, ObjectMapper mapper) throws SQLException {
        return CustomerIdentity.builder()
                .id(rs.getLong("id"))
                .customerId(rs.getLong("customer_id"))
                .provider(Provider.fromCode(rs.getString("provider")))
                .externalId(rs.getString("external_id"))
                .email(rs.getString("email"))
                .phone(rs.getString("phone"))
                .metadata(readMetadata(mapper, rs.getString("metadata")))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static Array bigintArray(PreparedStatement ps, Collection<Long> values) throws SQLException {
        return ps.getConnection().createArrayOf("bigint", values.toArray(new Long[0]));
    }

    static Map<String, Object> readMetadata(ObjectMapper mapper, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("Unreadable identity metadata: " + e.getOriginalMessage(), e);
        }
    }

    static String writeJson(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
