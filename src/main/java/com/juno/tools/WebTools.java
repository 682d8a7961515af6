package com.juno.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.juno.core.config.JunoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Web search (Tavily API) and page fetching tools for the research team.
 * Failures are returned to the agent as {@code Error:} strings.
 */
public class WebTools {

    private static final Logger log = LoggerFactory.getLogger(WebTools.class);

    static final String TAVILY_URL = "https://api.tavily.com/search";
    static final int MAX_PAGE_CHARS = 20_000;

    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NON_CONTENT = Pattern.compile("<(script|style|noscript)[^>]*>.*?</\\1>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\s*\\n\\s*\\n\\s*");

    private final JunoProperties.Tools properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebTools(JunoProperties.Tools properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    WebTools(JunoProperties.Tools properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Tool(description = "Search the web for information on a query.")
    public String searchWeb(@ToolParam(description = "The search query") String query) {
        if (properties.getTavilyApiKey() == null || properties.getTavilyApiKey().isBlank()) {
            return "Error: web search is not configured (juno.tools.tavily-api-key is empty)";
        }
        try {
            var body = objectMapper.createObjectNode();
            body.put("api_key", properties.getTavilyApiKey());
            body.put("query", query);
            body.put("max_results", properties.getSearchResults());
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(TAVILY_URL))
                    .timeout(Duration.ofSeconds(properties.getFetchTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return "Error: search failed (HTTP %d)".formatted(response.statusCode());
            }
            var results = objectMapper.readTree(response.body()).path("results");
            var sb = new StringBuilder();
            for (var result : results) {
                sb.append("- ").append(result.path("title").asText(""))
                        .append(" (").append(result.path("url").asText("")).append(")\n  ")
                        .append(result.path("content").asText("")).append('\n');
            }
            return sb.length() == 0 ? "No results found for: " + query : sb.toString();
        } catch (IOException e) {
            log.warn("Web search failed for '{}': {}", query, e.getMessage());
            return "Error: search failed: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Error: search interrupted";
        }
    }

    @Tool(description = "Fetch the provided web pages and return their text content.")
    public String scrapeWebpages(@ToolParam(description = "URLs of the pages to fetch") List<String> urls) {
        var sb = new StringBuilder();
        for (String url : urls) {
            sb.append(fetch(url)).append("\n\n");
        }
        return sb.toString().trim();
    }

    private String fetch(String url) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.getFetchTimeoutSeconds()))
                    .header("Accept", "text/html,text/plain")
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                return "<Document name=\"" + url + "\">\nError: HTTP " + response.statusCode() + "\n</Document>";
            }
            String html = response.body();
            return "<Document name=\"" + title(html, url) + "\">\n" + toText(html) + "\n</Document>";
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Fetching {} failed: {}", url, e.getMessage());
            return "<Document name=\"" + url + "\">\nError: " + e.getMessage() + "\n</Document>";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "<Document name=\"" + url + "\">\nError: fetch interrupted\n</Document>";
        }
    }

    static String title(String html, String fallback) {
        Matcher m = TITLE.matcher(html);
        return m.find() ? m.group(1).trim() : fallback;
    }

    static String toText(String html) {
        String text = NON_CONTENT.matcher(html).replaceAll(" ");
        text = TAG.matcher(text).replaceAll("\n");
        text = text.replace("&nbsp;", " ").replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">");
        text = BLANK_RUNS.matcher(text).replaceAll("\n\n").trim();
        return text.length() > MAX_PAGE_CHARS ? text.substring(0, MAX_PAGE_CHARS) : text;
    }
}
