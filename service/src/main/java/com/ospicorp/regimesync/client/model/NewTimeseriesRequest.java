package com.ospicorp.regimesync.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of a derived timeseries resource. Unset metadata is sent as explicit nulls.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record NewTimeseriesRequest(
    String name,
    @JsonProperty("access_modifier") int accessModifier,
    String code,
    String supplier,
    String location,
    @JsonProperty("supplier_code") String supplierCode,
    @JsonProperty("value_type") int valueType,
    String frequency,
    @JsonProperty("observation_type") int observationType,
    @JsonProperty("timeseries_type") String timeseriesType,
    String datasource
) {
  public static final int ACCESS_PUBLIC = 0;
  public static final int VALUE_TYPE_FLOAT = 1;

  public static NewTimeseriesRequest floatSeries(String name, String code, String supplier,
      String locationId, int observationTypeId) {
    return new NewTimeseriesRequest(name, ACCESS_PUBLIC, code, supplier, locationId, null,
        VALUE_TYPE_FLOAT, null, observationTypeId, null, null);
  }
}
