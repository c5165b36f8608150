package com.saludsync.reps.model;

/** Installed-capacity groups of the REPS catalog, with the label the portal exports. */
public enum CapacityGroup {
    BEDS("CAMAS"),
    STRETCHERS("CAMILLAS"),
    CONSULTING_ROOMS("CONSULTORIOS"),
    ROOMS("SALAS"),
    AMBULANCES("AMBULANCIAS"),
    CHAIRS("SILLAS"),
    TABLES("MESAS"),
    EQUIPMENT("EQUIPOS"),
    OTHER("OTROS");

    private final String repsLabel;

    CapacityGroup(String repsLabel) {
        this.repsLabel = repsLabel;
    }

    public String getRepsLabel() { return repsLabel; }
}
