package org.carball.showplan.model.plan;

public record ThreadReservation(int nodeId, int reservedThreads) {}
