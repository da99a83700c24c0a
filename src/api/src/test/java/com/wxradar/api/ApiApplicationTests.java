package com.wxradar.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wxradar.common.location.LocationRecord;
import com.wxradar.common.store.ReportKeyspace;
import com.wxradar.common.store.WeatherStore;
import java.net.URI;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "wx.storage.type=memory")
@AutoConfigureMockMvc
class ApiApplicationTests {
  @Autowired private MockMvc mockMvc;
  @Autowired private WeatherStore store;

  @BeforeEach
  void seed() {
    store.createLocationIfAbsent(
        new LocationRecord("UKLL", "Lviv International Airport", "Lviv", "UA", 49.8125, 23.9561, 1071));
    store.upsertWithTtl(ReportKeyspace.METAR, "EGLL", "METAR EGLL 011220Z 24012KT 9999", 600);
  }

  @Test
  void sixteenCodesAreServed() throws Exception {
    mockMvc.perform(get("/metar").queryParam("location", codes(15) + ",EGLL"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].location").value("EGLL"));
  }

  @Test
  void seventeenCodesAreForbidden() throws Exception {
    mockMvc.perform(get("/metar").queryParam("location", codes(17)))
        .andExpect(status().isForbidden())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"));
  }

  @Test
  void unknownSingleLocationIsNotFound() throws Exception {
    mockMvc.perform(get("/all/ZZZZ")).andExpect(status().isNotFound());
  }

  @Test
  void locationWithoutReportsServesMetadataOnly() throws Exception {
    mockMvc.perform(get("/all/UKLL"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.location").value("UKLL"))
        .andExpect(jsonPath("$.name").value("Lviv International Airport"))
        .andExpect(jsonPath("$.metar").doesNotExist())
        .andExpect(jsonPath("$.taf").doesNotExist());
  }

  @Test
  void metarForKnownLocationWithoutReportIsCodeOnly() throws Exception {
    mockMvc.perform(get("/metar/UKLL"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.location").value("UKLL"))
        .andExpect(jsonPath("$.name").doesNotExist());
  }

  @Test
  void headIsServed() throws Exception {
    mockMvc.perform(head("/metar/EGLL")).andExpect(status().isOk());
  }

  @Test
  void optionsWithoutCorsAnswersAllow() throws Exception {
    mockMvc.perform(options("/metar/EGLL"))
        .andExpect(status().isNoContent())
        .andExpect(header().string("Allow", "GET, HEAD, OPTIONS"))
        .andExpect(header().string("Cache-Control", "no-cache"))
        .andExpect(header().doesNotExist("Access-Control-Allow-Origin"));
  }

  @Test
  void corsPreflightAnswersCorsHeaders() throws Exception {
    mockMvc.perform(options("/metar/EGLL")
            .header("Origin", "https://example.org")
            .header("Access-Control-Request-Method", "GET"))
        .andExpect(status().isNoContent())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"))
        .andExpect(header().string("Access-Control-Allow-Methods", "GET, HEAD, OPTIONS"))
        .andExpect(header().doesNotExist("Allow"));
  }

  @Test
  void writeMethodsAreNotAllowed() throws Exception {
    mockMvc.perform(post("/metar/EGLL"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(header().string("Allow", "GET, HEAD, OPTIONS"))
        .andExpect(jsonPath("$.error").value("method_not_allowed"))
        .andExpect(header().doesNotExist("Access-Control-Allow-Origin"))
        .andExpect(header().doesNotExist("Access-Control-Allow-Methods"));
  }

  @Test
  void writeMethodsFromBrowsersGetNoCorsHeaders() throws Exception {
    mockMvc.perform(delete("/metar/EGLL").header("Origin", "https://example.org"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(header().doesNotExist("Access-Control-Allow-Origin"));
  }

  @Test
  void malformedQueryEncodingIsBadRequest() throws Exception {
    mockMvc.perform(get("/metar").with(request -> {
          request.setQueryString("location=UK%ZZ");
          return request;
        }))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void percentEncodedPathCodeIsDecoded() throws Exception {
    mockMvc.perform(get(URI.create("/metar/%45GLL")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.location").value("EGLL"))
        .andExpect(jsonPath("$.metar").value("METAR EGLL 011220Z 24012KT 9999"));
  }

  @Test
  void pathsOutsideTheApiAreForbidden() throws Exception {
    mockMvc.perform(get("/foo")).andExpect(status().isForbidden());
    mockMvc.perform(get("/a/b/c")).andExpect(status().isForbidden());
  }

  @Test
  void landingPageIsServed() throws Exception {
    mockMvc.perform(get("/")).andExpect(status().isOk());
  }

  private static String codes(int count) {
    return IntStream.range(0, count).mapToObj(i -> String.format("K%03d", i)).collect(Collectors.joining(","));
  }
}
