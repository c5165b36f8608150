package com.saludsync.reps.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical column names used by the pipeline and the header variants seen in REPS exports.
 * Aliases are compared after {@link FieldNormalizer#headerKey(String)}.
 */
public final class RepsColumns {

    private RepsColumns() {}

    public static final String PROVIDER_CODE = "codigo_prestador";
    public static final String SITE_NUMBER = "numero_sede";
    public static final String SITE_NAME = "nombre_sede";
    public static final String SITE_TYPE = "tipo_sede";
    public static final String DEPARTMENT = "departamento";
    public static final String MUNICIPALITY = "municipio";
    public static final String MUNICIPALITY_CODE = "codigo_municipio";
    public static final String ADDRESS = "direccion";
    public static final String PHONE = "telefono";
    public static final String EMAIL = "email";
    public static final String MANAGER = "gerente";
    public static final String ENABLED = "habilitado";
    public static final String OPENING_DATE = "fecha_apertura";
    public static final String CLOSING_DATE = "fecha_cierre";
    public static final String MAIN_SITE_NUMBER = "numero_sede_principal";

    public static final String SERVICE_GROUP_CODE = "grse_codigo";
    public static final String SERVICE_GROUP_NAME = "grse_nombre";
    public static final String SERVICE_CODE = "serv_codigo";
    public static final String SERVICE_NAME = "serv_nombre";
    public static final String AMBULATORY = "ambulatorio";
    public static final String HOSPITAL = "hospitalario";
    public static final String MOBILE_UNIT = "unidad_movil";
    public static final String DOMICILIARY = "domiciliario";
    public static final String OTHER_EXTRAMURAL = "otras_extramural";
    public static final String INTRAMURAL = "modalidad_intramural";
    public static final String TELEMEDICINE = "modalidad_telemedicina";
    public static final String LOW_COMPLEXITY = "complejidad_baja";
    public static final String MEDIUM_COMPLEXITY = "complejidad_media";
    public static final String HIGH_COMPLEXITY = "complejidad_alta";
    public static final String COMPLEXITIES = "complejidades";
    public static final String DISTINCTIVE_NUMBER = "numero_distintivo";
    public static final String CAPACITY = "capacidad_instalada";

    public static final String CAPACITY_GROUP = "grupo_capacidad";
    public static final String CONCEPT_CODE = "codigo_concepto";
    public static final String CONCEPT_NAME = "concepto";
    public static final String QUANTITY = "cantidad";
    public static final String PLATE_NUMBER = "numero_placa";
    public static final String AMBULANCE_MODALITY = "modalidad";
    public static final String VEHICLE_MODEL = "modelo";
    public static final String PROPERTY_CARD = "numero_tarjeta";

    public static final List<String> FACILITY_REQUIRED = List.of(
            PROVIDER_CODE, SITE_NUMBER, SITE_NAME, DEPARTMENT, MUNICIPALITY, ADDRESS);

    public static final List<String> SERVICE_REQUIRED = List.of(
            PROVIDER_CODE, SITE_NUMBER, SITE_NAME, DEPARTMENT, MUNICIPALITY, ADDRESS, SERVICE_CODE, SERVICE_NAME);

    // capacity exports often leave the site number out; the importer resolves the facility without it
    public static final List<String> CAPACITY_REQUIRED = List.of(
            PROVIDER_CODE, SITE_NAME, CAPACITY_GROUP, CONCEPT_NAME);

    /** canonical name -> accepted header keys, first match wins */
    public static final Map<String, List<String>> ALIASES;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(PROVIDER_CODE, List.of("codigo_prestador", "habi_codigo_habilitacion", "codigo_habilitacion", "cod_habilitacion", "codigo_prestador_reps", "codigo_sede_prestador"));
        m.put(SITE_NUMBER, List.of("numero_sede", "sede_numero", "num_sede", "codigo_sede", "codigo_de_la_sede"));
        m.put(SITE_NAME, List.of("nombre_sede", "sede_nombre", "nombre_sede_prestador", "nombre"));
        m.put(SITE_TYPE, List.of("tipo_sede", "clase_sede", "sede_tipo"));
        m.put(DEPARTMENT, List.of("departamento", "depa_nombre", "nombre_departamento", "depa_codigo"));
        m.put(MUNICIPALITY, List.of("municipio", "muni_nombre", "nombre_municipio"));
        m.put(MUNICIPALITY_CODE, List.of("codigo_municipio", "muni_codigo", "cod_municipio"));
        m.put(ADDRESS, List.of("direccion", "sede_direccion"));
        m.put(PHONE, List.of("telefono", "sede_telefono"));
        m.put(EMAIL, List.of("email", "correo", "sede_email", "correo_electronico"));
        m.put(MANAGER, List.of("gerente", "representante_legal", "contacto_administrativo"));
        m.put(ENABLED, List.of("habilitado", "estado", "estado_sede"));
        m.put(OPENING_DATE, List.of("fecha_apertura", "fecha_habilitacion"));
        m.put(CLOSING_DATE, List.of("fecha_cierre", "fecha_vencimiento"));
        m.put(MAIN_SITE_NUMBER, List.of("numero_sede_principal", "sede_principal"));
        m.put(SERVICE_GROUP_CODE, List.of("grse_codigo", "grupo_codigo"));
        m.put(SERVICE_GROUP_NAME, List.of("grse_nombre", "grupo", "grupo_servicio"));
        m.put(SERVICE_CODE, List.of("serv_codigo", "codigo_servicio"));
        m.put(SERVICE_NAME, List.of("serv_nombre", "nombre_servicio"));
        m.put(AMBULATORY, List.of("ambulatorio"));
        m.put(HOSPITAL, List.of("hospitalario"));
        m.put(MOBILE_UNIT, List.of("unidad_movil"));
        m.put(DOMICILIARY, List.of("domiciliario"));
        m.put(OTHER_EXTRAMURAL, List.of("otras_extramural"));
        m.put(INTRAMURAL, List.of("modalidad_intramural", "intramural"));
        m.put(TELEMEDICINE, List.of("modalidad_telemedicina", "telemedicina"));
        m.put(LOW_COMPLEXITY, List.of("complejidad_baja"));
        m.put(MEDIUM_COMPLEXITY, List.of("complejidad_media"));
        m.put(HIGH_COMPLEXITY, List.of("complejidad_alta"));
        m.put(COMPLEXITIES, List.of("complejidades", "complejidad"));
        m.put(DISTINCTIVE_NUMBER, List.of("numero_distintivo", "distintivo"));
        m.put(CAPACITY, List.of("capacidad_instalada", "capacidad"));
        m.put(CAPACITY_GROUP, List.of("grupo_capacidad", "grupo"));
        m.put(CONCEPT_CODE, List.of("codigo_concepto", "coca_codigo"));
        m.put(CONCEPT_NAME, List.of("concepto", "coca_nombre", "nombre_concepto"));
        m.put(QUANTITY, List.of("cantidad"));
        m.put(PLATE_NUMBER, List.of("numero_placa", "numero_de_placa", "placa"));
        m.put(AMBULANCE_MODALITY, List.of("modalidad", "modalidad_ambulancia"));
        m.put(VEHICLE_MODEL, List.of("modelo"));
        m.put(PROPERTY_CARD, List.of("numero_tarjeta", "tarjeta_de_propiedad"));
        ALIASES = Collections.unmodifiableMap(m);
    }

    public static List<String> aliasesOf(String canonical) {
        return ALIASES.getOrDefault(canonical, List.of(canonical));
    }
}
