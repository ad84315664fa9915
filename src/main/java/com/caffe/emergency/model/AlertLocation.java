package com.caffe.emergency.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertLocation {
    private String parish;
    private String pollingStation;
    private Coordinates coordinates;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Coordinates {
        private double lat;
        private double lng;
    }

    public String describe() {
        return pollingStation == null || pollingStation.isBlank()
                ? parish
                : parish + ", " + pollingStation;
    }
}
