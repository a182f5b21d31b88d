package com.platform.tripcleaning.domain;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A single taxi trip as parsed from the raw source.
 * <p>
 * Required fields (timestamps, zones, distance, fare) may still be null here; the validator
 * rejects such records. Optional monetary fields are already defaulted to 0 by the parser.
 *
 * @param sourceRow zero-based row position in the source, used as the record identity until
 *                  the trip is persisted and receives a {@code trip_id}
 */
public record TripRecord(
        long sourceRow,
        LocalDateTime pickupDatetime,
        LocalDateTime dropoffDatetime,
        Integer pickupZoneId,
        Integer dropoffZoneId,
        Integer passengerCount,
        Double tripDistance,
        Double fareAmount,
        Double tipAmount,
        Double tollsAmount,
        Double extra,
        Double mtaTax,
        Double improvementSurcharge,
        Double congestionSurcharge,
        Double airportFee,
        Double totalAmount,
        Integer vendorId,
        Integer ratecodeId,
        String storeAndFwdFlag,
        Integer paymentType
) {

    /**
     * Trip duration in seconds including the sub-second part, or null when either
     * timestamp is missing.
     */
    public Double durationSeconds() {
        if (pickupDatetime == null || dropoffDatetime == null) {
            return null;
        }
        return Duration.between(pickupDatetime, dropoffDatetime).toNanos() / 1e9;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .sourceRow(sourceRow)
                .pickupDatetime(pickupDatetime)
                .dropoffDatetime(dropoffDatetime)
                .pickupZoneId(pickupZoneId)
                .dropoffZoneId(dropoffZoneId)
                .passengerCount(passengerCount)
                .tripDistance(tripDistance)
                .fareAmount(fareAmount)
                .tipAmount(tipAmount)
                .tollsAmount(tollsAmount)
                .extra(extra)
                .mtaTax(mtaTax)
                .improvementSurcharge(improvementSurcharge)
                .congestionSurcharge(congestionSurcharge)
                .airportFee(airportFee)
                .totalAmount(totalAmount)
                .vendorId(vendorId)
                .ratecodeId(ratecodeId)
                .storeAndFwdFlag(storeAndFwdFlag)
                .paymentType(paymentType);
    }

    public static final class Builder {
        private long sourceRow;
        private LocalDateTime pickupDatetime;
        private LocalDateTime dropoffDatetime;
        private Integer pickupZoneId;
        private Integer dropoffZoneId;
        private Integer passengerCount;
        private Double tripDistance;
        private Double fareAmount;
        private Double tipAmount;
        private Double tollsAmount;
        private Double extra;
        private Double mtaTax;
        private Double improvementSurcharge;
        private Double congestionSurcharge;
        private Double airportFee;
        private Double totalAmount;
        private Integer vendorId;
        private Integer ratecodeId;
        private String storeAndFwdFlag;
        private Integer paymentType;

        private Builder() {}

        public Builder sourceRow(long sourceRow) { this.sourceRow = sourceRow; return this; }
        public Builder pickupDatetime(LocalDateTime v) { this.pickupDatetime = v; return this; }
        public Builder dropoffDatetime(LocalDateTime v) { this.dropoffDatetime = v; return this; }
        public Builder pickupZoneId(Integer v) { this.pickupZoneId = v; return this; }
        public Builder dropoffZoneId(Integer v) { this.dropoffZoneId = v; return this; }
        public Builder passengerCount(Integer v) { this.passengerCount = v; return this; }
        public Builder tripDistance(Double v) { this.tripDistance = v; return this; }
        public Builder fareAmount(Double v) { this.fareAmount = v; return this; }
        public Builder tipAmount(Double v) { this.tipAmount = v; return this; }
        public Builder tollsAmount(Double v) { this.tollsAmount = v; return this; }
        public Builder extra(Double v) { this.extra = v; return this; }
        public Builder mtaTax(Double v) { this.mtaTax = v; return this; }
        public Builder improvementSurcharge(Double v) { this.improvementSurcharge = v; return this; }
        public Builder congestionSurcharge(Double v) { this.congestionSurcharge = v; return this; }
        public Builder airportFee(Double v) { this.airportFee = v; return this; }
        public Builder totalAmount(Double v) { this.totalAmount = v; return this; }
        public Builder vendorId(Integer v) { this.vendorId = v; return this; }
        public Builder ratecodeId(Integer v) { this.ratecodeId = v; return this; }
        public Builder storeAndFwdFlag(String v) { this.storeAndFwdFlag = v; return this; }
        public Builder paymentType(Integer v) { this.paymentType = v; return this; }

        public TripRecord build() {
            return new TripRecord(sourceRow, pickupDatetime, dropoffDatetime, pickupZoneId, dropoffZoneId,
                    passengerCount, tripDistance, fareAmount, tipAmount, tollsAmount, extra, mtaTax,
                    improvementSurcharge, congestionSurcharge, airportFee, totalAmount, vendorId,
                    ratecodeId, storeAndFwdFlag, paymentType);
        }
    }
}
