package com.saludsync.reps.service;

import com.saludsync.reps.exception.RowCreationException;
import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.FieldNormalizer;
import com.saludsync.reps.util.RepsColumns;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class CapacityMapper {

    private static final int CONCEPT_CODE_MAX = 32;
    private static final int PLATE_MAX = 16;

    public CapacityGroup resolveGroup(RowValidationResult row, List<String> warnings) {
        String raw = row.get(RepsColumns.CAPACITY_GROUP);
        Optional<CapacityGroup> group = FieldNormalizer.capacityGroup(raw);
        if (group.isPresent()) return group.get();
        warnings.add("Fila " + row.getRowIndex() + ": grupo desconocido '" + raw + "', se usa " + CapacityGroup.OTHER.getRepsLabel());
        return CapacityGroup.OTHER;
    }

    /** The concept code from the file, or one derived from group and concept name when the column is empty. */
    public String conceptCode(RowValidationResult row, CapacityGroup group) {
        String code = row.get(RepsColumns.CONCEPT_CODE);
        if (!code.isEmpty()) return code;
        String concept = FieldNormalizer.stripAccents(row.get(RepsColumns.CONCEPT_NAME))
                .toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", "_");
        String label = group.getRepsLabel();
        return label.substring(0, Math.min(3, label.length())) + "_" + concept.substring(0, Math.min(10, concept.length()));
    }

    public String plateNumber(RowValidationResult row) {
        return row.get(RepsColumns.PLATE_NUMBER).toUpperCase(Locale.ROOT);
    }

    /** @throws RowCreationException when the quantity is negative */
    public int quantity(RowValidationResult row, List<String> warnings) {
        String raw = row.get(RepsColumns.QUANTITY);
        int quantity = FieldNormalizer.parseInt(raw, Integer.MIN_VALUE);
        if (quantity == Integer.MIN_VALUE) {
            if (!raw.isEmpty()) {
                warnings.add("Fila " + row.getRowIndex() + ": cantidad '" + raw + "' no numérica, se registra 0");
            }
            return 0;
        }
        if (quantity < 0) {
            throw new RowCreationException("la cantidad no puede ser negativa");
        }
        return quantity;
    }

    public InstalledCapacity toCapacity(RowValidationResult row, FacilityLocation facility, CapacityGroup group,
                                        String fileName, String actingUser, List<String> warnings) {
        InstalledCapacity c = new InstalledCapacity();
        c.setFacility(facility);
        c.setCapacityGroup(group);
        c.setConceptCode(conceptCode(row, group));
        c.setPlateNumber(plateNumber(row));
        c.setCreatedBy(actingUser);
        applyRow(c, row, group, fileName, actingUser, warnings);
        return c;
    }

    /** Copies every row-derived field onto {@code target}; facility, concept code and plate are its identity. */
    public void applyRow(InstalledCapacity target, RowValidationResult row, CapacityGroup group, String fileName,
                         String actingUser, List<String> warnings) {
        int quantity = quantity(row, warnings);
        target.setCapacityGroup(group);
        target.setConceptName(row.get(RepsColumns.CONCEPT_NAME));
        target.setQuantity(quantity);
        // REPS reports installed capacity only; all of it is taken as enabled and operating
        target.setEnabledQuantity(quantity);
        target.setOperatingQuantity(quantity);
        target.setAmbulanceModality(group == CapacityGroup.AMBULANCES ? ambulanceModality(row, warnings) : null);
        String model = row.get(RepsColumns.VEHICLE_MODEL);
        target.setVehicleModel(model.isEmpty() ? null : model.substring(0, Math.min(4, model.length())));
        String card = row.get(RepsColumns.PROPERTY_CARD);
        target.setPropertyCardNumber(card.isEmpty() ? null : card);
        target.setRepsCutoffAt(Instant.now());
        target.setSyncedFromReps(true);
        target.setNotes(truncate("Importado desde REPS - " + fileName, 500));
        target.setUpdatedBy(actingUser);
        requireFits("código de concepto", target.getConceptCode(), CONCEPT_CODE_MAX);
        requireFits("nombre de concepto", target.getConceptName(), 255);
        requireFits("número de placa", target.getPlateNumber(), PLATE_MAX);
        requireFits("tarjeta de propiedad", target.getPropertyCardNumber(), 64);
    }

    private static String ambulanceModality(RowValidationResult row, List<String> warnings) {
        String raw = row.get(RepsColumns.AMBULANCE_MODALITY);
        if (raw.isEmpty()) return null;
        Optional<String> modality = FieldNormalizer.ambulanceModality(raw);
        if (modality.isEmpty()) {
            warnings.add("Fila " + row.getRowIndex() + ": modalidad de ambulancia '" + raw + "' no reconocida");
        }
        return modality.orElse(null);
    }

    private static void requireFits(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new RowCreationException("el campo " + field + " excede " + max + " caracteres");
        }
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
