package org.carball.showplan.model.plan;

import java.util.List;

public record ThreadStatInfo(int branches, int usedThreads, List<ThreadReservation> reservations) {

    public ThreadStatInfo {
        reservations = List.copyOf(reservations);
    }
}
