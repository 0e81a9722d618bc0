package com.ospicorp.dataops.web;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.ops.AggregateResult;
import com.ospicorp.dataops.ops.DataOpsService;
import com.ospicorp.dataops.ops.PivotResult;
import com.ospicorp.dataops.outliers.DetectResult;
import com.ospicorp.dataops.outliers.TreatResult;
import com.ospicorp.dataops.summary.ColumnSummary;
import com.ospicorp.dataops.table.Table;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/data-ops")
@Tag(name = "Data Ops")
public class DataOpsController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final DataOpsService service;

  public DataOpsController(DataOpsService service) {
    this.service = service;
  }

  @PostMapping("/aggregate")
  @Operation(summary = "Group and aggregate",
      description = "Groups rows by one column and aggregates the others with role-appropriate functions.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Aggregated rows",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = AggregateResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unknown column or nothing to aggregate")
  })
  public ResponseEntity<?> aggregate(@RequestBody AggregateRequestBody body,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    AggregateResult result = service.aggregate(rows(body.data()), body.toRequest());
    return respond(format, accept, result.data(), AggregateResponse.of(result));
  }

  @PostMapping("/pivot")
  @Operation(summary = "Pivot",
      description = "Spreads the values of the index column into columns and reconstructs it per output row.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Pivoted rows",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = PivotResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unknown column or nothing to pivot")
  })
  public ResponseEntity<?> pivot(@RequestBody PivotRequestBody body,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    PivotResult result = service.pivot(rows(body.data()), body.toRequest());
    return respond(format, accept, result.data(), PivotResponse.of(result));
  }

  @PostMapping("/outliers/detect")
  @Operation(summary = "Detect outliers")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Flagged cells with per-column statistics",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DetectResult.class))),
      @ApiResponse(responseCode = "422", description = "Method unavailable or statistic undefined",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<DetectResult> detect(@RequestBody OutlierRequestBody body) {
    DetectResult result = service.detectOutliers(rows(body.data()), body.column(), body.method(),
        body.threshold());
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(result);
  }

  @PostMapping("/outliers/treat")
  @Operation(summary = "Treat outliers",
      description = "Detects outliers and removes, caps, winsorizes, transforms or imputes them.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Treated rows",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TreatResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "422", description = "Method unavailable or statistic undefined",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> treat(@RequestBody OutlierRequestBody body,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    TreatResult result = service.treatOutliers(rows(body.data()), body.column(), body.method(),
        body.threshold(), body.strategy(), body.strategyValue());
    return respond(format, accept, result.data(), TreatResponse.of(result));
  }

  @PostMapping("/summary")
  @Operation(summary = "Column summary", description = "Role, type and descriptive statistics per column.")
  public ResponseEntity<List<ColumnSummary>> summary(@RequestBody SummaryRequestBody body) {
    List<ColumnSummary> summaries = service.summarize(rows(body.data()), body.column());
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(summaries);
  }

  private static List<Map<String, Object>> rows(List<Map<String, Object>> data) {
    return data == null ? List.of() : data;
  }

  private static ResponseEntity<?> respond(String format, String accept, Table table,
      Object json) {
    MediaType contentType = selectMediaType(format, accept);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? table : json;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidInputException("Invalid format value \"" + format + "\"",
          "unknown-format", "Supported values: json, csv");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
