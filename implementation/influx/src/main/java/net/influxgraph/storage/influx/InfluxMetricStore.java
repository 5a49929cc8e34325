// This file is part of influxgraph.
// Copyright (C) 2026  The influxgraph Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.influxgraph.storage.influx;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.http.HttpResponse;
import org.apache.http.NameValuePair;
import org.apache.http.ParseException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Deferred;

import net.influxgraph.configuration.Configuration;
import net.influxgraph.configuration.ConfigurationEntrySchema;
import net.influxgraph.core.BaseFinderPlugin;
import net.influxgraph.data.DataPoint;
import net.influxgraph.exceptions.RemoteQueryExecutionException;
import net.influxgraph.storage.MetricStore;
import net.influxgraph.storage.WritableMetricStore;
import net.influxgraph.utils.DateTime;
import net.influxgraph.utils.JSON;

/**
 * A store backed by the InfluxDB 1.x HTTP API. Every series is a
 * measurement with a single "value" field. Names are listed with
 * {@code SHOW MEASUREMENTS}, points are read with one {@code SELECT} per
 * call and written with the line protocol at second precision.
 * <p>
 * Connections are pooled and shared by concurrent callers. Every response
 * is consumed and closed before the call returns.
 */
public class InfluxMetricStore extends BaseFinderPlugin
    implements MetricStore, WritableMetricStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxMetricStore.class);

  public static final String TYPE = "InfluxMetricStore";

  public static final String KEY_PREFIX = "influxdb.";
  public static final String HOST_KEY = KEY_PREFIX + "host";
  public static final String PORT_KEY = KEY_PREFIX + "port";
  public static final String USER_KEY = KEY_PREFIX + "user";
  public static final String PASS_KEY = KEY_PREFIX + "pass";
  public static final String DB_KEY = KEY_PREFIX + "db";
  public static final String SSL_KEY = KEY_PREFIX + "ssl";
  public static final String TIMEOUT_KEY = KEY_PREFIX + "timeout";
  public static final String MAX_CONNECTIONS_KEY =
      KEY_PREFIX + "max_connections";

  /** The client, built at init unless one was given. */
  protected volatile CloseableHttpClient client;

  /** The scheme, host and port, e.g. "http://localhost:8086". */
  protected String endpoint;

  /** The database name. */
  protected String database;

  /** Credentials, null to skip. */
  protected String user;
  protected String pass;

  /** Default ctor. */
  public InfluxMetricStore() { }

  /**
   * Ctor with a client to use instead of building a pool.
   * @param client A non-null client. Closed on shutdown.
   */
  @VisibleForTesting
  InfluxMetricStore(final CloseableHttpClient client) {
    this.client = client;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Deferred<Object> initialize(final Configuration config,
                                     final String id) {
    super.initialize(config, Strings.isNullOrEmpty(id) ? TYPE : id);
    try {
      registerConfigs(config);
      final boolean ssl = config.getBoolean(SSL_KEY);
      endpoint = (ssl ? "https://" : "http://") + config.getString(HOST_KEY)
          + ":" + config.getInt(PORT_KEY);
      database = config.getString(DB_KEY);
      user = config.getString(USER_KEY);
      pass = config.getString(PASS_KEY);
      if (client == null) {
        client = buildClient(config.getInt(TIMEOUT_KEY),
            config.getInt(MAX_CONNECTIONS_KEY));
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to initialize the InfluxDB store " + this.id, e);
      return Deferred.fromError(e);
    }
    LOG.info("Initialized InfluxDB store " + this.id + " for database "
        + database + " at " + endpoint);
    return Deferred.fromResult(null);
  }

  @Override
  public Deferred<Object> shutdown() {
    if (client != null) {
      try {
        client.close();
      } catch (IOException e) {
        LOG.error("Failed to close the HTTP client", e);
      }
    }
    return Deferred.fromResult(null);
  }

  @Override
  public String version() {
    return "1.0.0";
  }

  /**
   * Registers the connection keys if they are not already present.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(HOST_KEY)) {
      config.register(HOST_KEY, "localhost", "The InfluxDB host name.");
    }
    if (!config.hasProperty(PORT_KEY)) {
      config.register(PORT_KEY, 8086, "The InfluxDB HTTP API port.");
    }
    if (!config.hasProperty(USER_KEY)) {
      config.register(USER_KEY, "root", "The InfluxDB user name.");
    }
    if (!config.hasProperty(PASS_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(PASS_KEY)
          .setType(String.class)
          .setDefaultValue("root")
          .isNullable()
          .isSecret()
          .setDescription("The InfluxDB password."));
    }
    if (!config.hasProperty(DB_KEY)) {
      config.register(DB_KEY, "graphite", "The InfluxDB database name.");
    }
    if (!config.hasProperty(SSL_KEY)) {
      config.register(SSL_KEY, false, "Whether or not to use HTTPS.");
    }
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(TIMEOUT_KEY, 30000, "The connect, socket and pool "
          + "lease timeout in milliseconds for store calls.");
    }
    if (!config.hasProperty(MAX_CONNECTIONS_KEY)) {
      config.register(MAX_CONNECTIONS_KEY, 25, "The maximum number of "
          + "pooled connections to InfluxDB.");
    }
  }

  @Override
  public Set<String> seriesNames(final String regex) {
    final JsonNode results = query(InfluxQL.showMeasurements(regex));
    final Set<String> names = Sets.newHashSet();
    for (final JsonNode series : series(results)) {
      final JsonNode values = series.get("values");
      if (values == null || !values.isArray()) {
        continue;
      }
      for (final JsonNode row : values) {
        if (row.isArray() && row.size() > 0 && row.get(0).isTextual()) {
          names.add(row.get(0).asText());
        } else {
          LOG.warn("Skipping unexpected measurement row: " + row);
        }
      }
    }
    return names;
  }

  @Override
  public Map<String, List<DataPoint>> readPoints(final String regex,
                                                 final long start,
                                                 final long end) {
    if (Strings.isNullOrEmpty(regex)) {
      throw new IllegalArgumentException("Regex cannot be null or empty.");
    }
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    final JsonNode results = query(InfluxQL.selectValues(regex, start, end));
    final Map<String, List<DataPoint>> points = Maps.newHashMap();
    for (final JsonNode series : series(results)) {
      final JsonNode name = series.get("name");
      final JsonNode values = series.get("values");
      if (name == null || !name.isTextual()
          || values == null || !values.isArray()) {
        LOG.warn("Skipping unexpected series: " + series);
        continue;
      }
      final int time_idx = column(series, "time", 0);
      final int value_idx = column(series, InfluxQL.VALUE_FIELD, 1);
      List<DataPoint> measurement = points.get(name.asText());
      for (final JsonNode row : values) {
        final JsonNode time = row.get(time_idx);
        final JsonNode value = row.get(value_idx);
        if (time == null || !time.canConvertToLong()) {
          LOG.warn("Skipping row with an invalid timestamp in "
              + name.asText() + ": " + row);
          continue;
        }
        if (value == null || value.isNull()) {
          continue;
        }
        if (!value.isNumber()) {
          LOG.warn("Skipping non-numeric value in " + name.asText() + ": "
              + row);
          continue;
        }
        if (measurement == null) {
          measurement = Lists.newArrayList();
          points.put(name.asText(), measurement);
        }
        measurement.add(new DataPoint(name.asText(), time.asLong(),
            value.asDouble()));
      }
    }
    return points;
  }

  @Override
  public void write(final List<DataPoint> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    final StringBuilder buf = new StringBuilder();
    int lines = 0;
    for (final DataPoint point : points) {
      if (point.value() == null || point.value().isNaN()
          || point.value().isInfinite()) {
        continue;
      }
      if (lines++ > 0) {
        buf.append('\n');
      }
      InfluxQL.appendLine(buf, point);
    }
    if (lines == 0) {
      return;
    }
    checkInitialized();

    final List<NameValuePair> params = Lists.newArrayList();
    params.add(new BasicNameValuePair("precision", "s"));
    final HttpPost post = new HttpPost(uri("/write", params));
    post.setEntity(new StringEntity(buf.toString(),
        ContentType.create("text/plain", StandardCharsets.UTF_8)));
    execute(post);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Wrote " + lines + " of " + points.size() + " points to "
          + database);
    }
  }

  /**
   * Runs the statement and returns the "results" array.
   * @param statement A non-null InfluxQL statement.
   * @return The non-null results array.
   * @throws RemoteQueryExecutionException if the call failed or a result
   * carried an error.
   */
  JsonNode query(final String statement) {
    checkInitialized();
    final List<NameValuePair> params = Lists.newArrayList();
    params.add(new BasicNameValuePair("epoch", "s"));
    final HttpPost post = new HttpPost(uri("/query", params));
    post.setEntity(new UrlEncodedFormEntity(Collections.singletonList(
        new BasicNameValuePair("q", statement)), StandardCharsets.UTF_8));

    final long start = DateTime.nanoTime();
    final String content = execute(post);
    final JsonNode root;
    try {
      root = JSON.parseToTree(content);
    } catch (IllegalArgumentException e) {
      LOG.error("Failed to parse the response to [" + statement + "]: "
          + content, e);
      throw new RemoteQueryExecutionException("Unparseable response from "
          + "InfluxDB", endpoint, 500, e);
    }
    final JsonNode results = root.get("results");
    if (results == null || !results.isArray()) {
      throw new RemoteQueryExecutionException("Response to [" + statement
          + "] was missing the results: " + content, endpoint, 500);
    }
    for (final JsonNode result : results) {
      final JsonNode error = result.get("error");
      if (error != null && !error.isNull()) {
        throw new RemoteQueryExecutionException(error.asText(), endpoint,
            400);
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Executed [" + statement + "] in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
    return results;
  }

  /**
   * Executes the request and reads the body, always closing the response.
   * @param request A non-null request.
   * @return The body, empty if there was none.
   * @throws RemoteQueryExecutionException if the call failed.
   */
  private String execute(final HttpPost request) {
    try (final CloseableHttpResponse response = client.execute(request)) {
      return parseResponse(response, endpoint);
    } catch (IOException e) {
      LOG.error("Failed to call InfluxDB at " + endpoint, e);
      throw new RemoteQueryExecutionException("Failed to call InfluxDB: "
          + e.getMessage(), endpoint, 503, e);
    }
  }

  /**
   * Handles decompressing the entity and parsing it to a string. If the
   * status isn't a success then we throw with the error InfluxDB gave us.
   * @param response The non-null response to parse.
   * @param remote_host The remote endpoint.
   * @return The content, empty if there was no entity.
   * @throws RemoteQueryExecutionException if the status was not 2xx or the
   * content could not be read.
   */
  static String parseResponse(final HttpResponse response,
                              final String remote_host) {
    final int status = response.getStatusLine().getStatusCode();
    String content = "";
    if (response.getEntity() != null) {
      try {
        final String encoding = (response.getEntity().getContentEncoding() != null &&
            response.getEntity().getContentEncoding().getValue() != null ?
                response.getEntity().getContentEncoding().getValue().toLowerCase() :
                  "");
        if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
          content = EntityUtils.toString(
              new GzipDecompressingEntity(response.getEntity()));
        } else if (encoding.equals("deflate")) {
          content = EntityUtils.toString(
              new DeflateDecompressingEntity(response.getEntity()));
        } else if (encoding.equals("")) {
          content = EntityUtils.toString(response.getEntity());
        } else {
          throw new RemoteQueryExecutionException("Unhandled content encoding ["
              + encoding + "] : " + response, remote_host, 500);
        }
      } catch (ParseException | IOException e) {
        LOG.error("Failed to parse content from HTTP response: " + response, e);
        throw new RemoteQueryExecutionException("Content parsing failure for: "
            + response, remote_host, 500, e);
      }
    }

    if (status >= 200 && status < 300) {
      return content;
    }

    // InfluxDB reports failures as {"error": "message"}
    if (content.startsWith("{")) {
      try {
        final JsonNode error = JSON.parseToTree(content).get("error");
        if (error != null && !error.isNull()) {
          throw new RemoteQueryExecutionException(error.asText(), remote_host,
              status);
        }
      } catch (IllegalArgumentException e) {
        LOG.warn("Failed to parse the JSON error: " + content, e);
      }
    }
    throw new RemoteQueryExecutionException(content.isEmpty() ?
        response.getStatusLine().toString() : content, remote_host, status);
  }

  /**
   * @param path The API path.
   * @param params Params specific to the call, the database and credentials
   * are added.
   * @return The URI.
   */
  private URI uri(final String path, final List<NameValuePair> params) {
    try {
      final URIBuilder builder = new URIBuilder(endpoint)
          .setPath(path)
          .addParameter("db", database);
      if (!Strings.isNullOrEmpty(user)) {
        builder.addParameter("u", user);
        builder.addParameter("p", Strings.nullToEmpty(pass));
      }
      builder.addParameters(params);
      return builder.build();
    } catch (URISyntaxException e) {
      throw new RemoteQueryExecutionException("Invalid InfluxDB endpoint: "
          + endpoint, endpoint, 400, e);
    }
  }

  private void checkInitialized() {
    if (client == null || endpoint == null) {
      throw new IllegalStateException("The store was not initialized.");
    }
  }

  /**
   * @param results The results array.
   * @return Every series of every result.
   */
  private static List<JsonNode> series(final JsonNode results) {
    final List<JsonNode> series = Lists.newArrayList();
    for (final JsonNode result : results) {
      final JsonNode nodes = result.get("series");
      if (nodes == null || !nodes.isArray()) {
        continue;
      }
      for (final JsonNode node : nodes) {
        series.add(node);
      }
    }
    return series;
  }

  /**
   * @return The index of the named column or the fallback if the series
   * has no column list.
   */
  private static int column(final JsonNode series,
                            final String name,
                            final int fallback) {
    final JsonNode columns = series.get("columns");
    if (columns == null || !columns.isArray()) {
      return fallback;
    }
    for (int i = 0; i < columns.size(); i++) {
      if (name.equals(columns.get(i).asText())) {
        return i;
      }
    }
    return fallback;
  }

  private static CloseableHttpClient buildClient(final int timeout,
                                                 final int max_connections) {
    final PoolingHttpClientConnectionManager manager =
        new PoolingHttpClientConnectionManager();
    manager.setMaxTotal(max_connections);
    manager.setDefaultMaxPerRoute(max_connections);
    return HttpClients.custom()
        .setConnectionManager(manager)
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectTimeout(timeout)
            .setSocketTimeout(timeout)
            .setConnectionRequestTimeout(timeout)
            .build())
        .build();
  }
}
