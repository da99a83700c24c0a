package com.wxradar.api.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wxradar.api.model.Endpoint;
import com.wxradar.api.model.LocationView;
import com.wxradar.api.service.LocationAggregator;
import com.wxradar.common.location.LocationRecord;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = {LocationController.class, StaticPageController.class},
    properties = "wx.storage.type=memory")
@AutoConfigureMockMvc(addFilters = false)
class LocationControllerTest {
  private static final LocationRecord LVIV =
      new LocationRecord("UKLL", "Lviv International Airport", "Lviv", "UA", 49.8125, 23.9561, 1071);

  @Autowired private MockMvc mockMvc;

  @MockBean private LocationAggregator aggregator;

  @Test
  void single_returnsObject() throws Exception {
    when(aggregator.lookupSingle(eq(Endpoint.ALL), eq("UKLL")))
        .thenReturn(LocationView.of("UKLL", "METAR UKLL 011200Z CAVOK", "", LVIV));

    mockMvc.perform(get("/all/ukll"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.location").value("UKLL"))
        .andExpect(jsonPath("$.metar").value("METAR UKLL 011200Z CAVOK"))
        .andExpect(jsonPath("$.taf").doesNotExist())
        .andExpect(jsonPath("$.country_code").value("UA"))
        .andExpect(jsonPath("$.altitude_meters").value(326))
        .andExpect(jsonPath("$.altitude_feet").value(1071));
  }

  @Test
  void zeroCoordinatesAndElevation_areOmitted() throws Exception {
    LocationRecord nullIsland = new LocationRecord("FZZZ", "Gulf Platform", "", "", 0.0, 0.0, 0);
    when(aggregator.lookupSingle(eq(Endpoint.LOCATION), eq("FZZZ")))
        .thenReturn(LocationView.of("FZZZ", null, null, nullIsland));

    mockMvc.perform(get("/location/FZZZ"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Gulf Platform"))
        .andExpect(jsonPath("$.city").doesNotExist())
        .andExpect(jsonPath("$.latitude").doesNotExist())
        .andExpect(jsonPath("$.longitude").doesNotExist())
        .andExpect(jsonPath("$.altitude_meters").doesNotExist())
        .andExpect(jsonPath("$.altitude_feet").doesNotExist());
  }

  @Test
  void percentEncodedPathCode_isDecoded() throws Exception {
    when(aggregator.lookupSingle(eq(Endpoint.METAR), eq("UKLL")))
        .thenReturn(LocationView.of("UKLL", "METAR UKLL", "", null));

    mockMvc.perform(get(URI.create("/metar/%55KLL")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.location").value("UKLL"));
  }

  @Test
  void malformedQueryEncoding_returns400() throws Exception {
    mockMvc.perform(get("/metar").with(request -> {
          request.setQueryString("location=UK%ZZ");
          return request;
        }))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
    verifyNoInteractions(aggregator);
  }

  @Test
  void batch_returnsArray() throws Exception {
    when(aggregator.lookup(eq(Endpoint.METAR), eq(List.of("UKLL", "EGLL"))))
        .thenReturn(List.of(LocationView.of("UKLL", "METAR UKLL", "", null)));

    mockMvc.perform(get("/metar").queryParam("location", "ukll,egll"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].location").value("UKLL"))
        .andExpect(jsonPath("$[0].name").doesNotExist());
  }

  @Test
  void notFound_returns404() throws Exception {
    when(aggregator.lookupSingle(eq(Endpoint.METAR), eq("ZZZZ")))
        .thenThrow(new NotFoundException("no data for location ZZZZ"));

    mockMvc.perform(get("/metar/ZZZZ"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  void invalidCode_returns422() throws Exception {
    mockMvc.perform(get("/taf/1KLL"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.error").value("unprocessable_entity"));
    verifyNoInteractions(aggregator);
  }

  @Test
  void extraSegment_returns400() throws Exception {
    mockMvc.perform(get("/metar/UKLL/x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void unknownParameter_returns400() throws Exception {
    mockMvc.perform(get("/metar/UKLL").queryParam("format", "xml"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void storageFailure_returns500() throws Exception {
    when(aggregator.lookupSingle(eq(Endpoint.TAF), eq("UKLL")))
        .thenThrow(new DataAccessResourceFailureException("redis down"));

    mockMvc.perform(get("/taf/UKLL"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("storage_unavailable"));
  }

  @Test
  void foreignPath_returns403() throws Exception {
    mockMvc.perform(get("/admin"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("forbidden"));
  }

  @Test
  void helpPage_isHtml() throws Exception {
    mockMvc.perform(get("/help/"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
        .andExpect(content().string(org.hamcrest.Matchers.containsString("Endpoints")));
  }
}
