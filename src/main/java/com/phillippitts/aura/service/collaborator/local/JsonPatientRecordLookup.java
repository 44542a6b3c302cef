package com.phillippitts.aura.service.collaborator.local;

import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.service.collaborator.PatientRecordLookup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Patient records held in memory, loaded once from a JSON array:
 * <pre>
 * [ { "id": 1, "name": "Emma Johnson", "age": 5, "gender": "Female",
 *     "medical_history": "...", "current_symptoms": "..." } ]
 * </pre>
 *
 * <p>A missing resource leaves the store empty (every lookup is a miss). A resource that
 * exists but cannot be parsed fails construction so a broken deployment is noticed at startup.
 */
public class JsonPatientRecordLookup implements PatientRecordLookup {
    private static final Logger LOG = LogManager.getLogger(JsonPatientRecordLookup.class);

    private final Map<Integer, PatientRecord> records;

    public JsonPatientRecordLookup(Map<Integer, PatientRecord> records) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    /**
     * @throws IllegalStateException if the resource exists but is not a valid patient array
     */
    public static JsonPatientRecordLookup fromResource(Resource resource) {
        if (resource == null || !resource.exists()) {
            LOG.warn("Patient store not found at {}; no patients available",
                    resource == null ? "<none>" : resource.getDescription());
            return new JsonPatientRecordLookup(Map.of());
        }
        try (InputStream in = resource.getInputStream()) {
            Map<Integer, PatientRecord> parsed = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            LOG.info("Loaded {} patient record(s) from {}", parsed.size(), resource.getDescription());
            return new JsonPatientRecordLookup(parsed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read patient store " + resource.getDescription(), e);
        } catch (JSONException | IllegalArgumentException | NullPointerException e) {
            throw new IllegalStateException("Invalid patient store " + resource.getDescription()
                    + ": " + e.getMessage(), e);
        }
    }

    static Map<Integer, PatientRecord> parse(String json) {
        JSONArray arr = new JSONArray(json);
        Map<Integer, PatientRecord> out = new LinkedHashMap<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject p = arr.getJSONObject(i);
            PatientRecord record = new PatientRecord(
                    p.getInt("id"),
                    p.getString("name"),
                    p.getInt("age"),
                    p.getString("gender"),
                    p.optString("medical_history", ""),
                    p.optString("current_symptoms", ""));
            if (out.putIfAbsent(record.id(), record) != null) {
                throw new IllegalArgumentException("duplicate patient id " + record.id());
            }
        }
        return out;
    }

    @Override
    public Optional<PatientRecord> findById(int patientId) {
        return Optional.ofNullable(records.get(patientId));
    }

    @Override
    public List<PatientRecord> findAll() {
        return List.copyOf(records.values());
    }
}
