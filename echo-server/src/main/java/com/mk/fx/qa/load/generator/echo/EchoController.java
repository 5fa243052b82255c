package com.mk.fx.qa.load.generator.echo;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Answers every GET with a small HTML page describing the request: client address, requested path,
 * server time and server hostname.
 */
@Slf4j
@RestController
public class EchoController {

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;
    private final String hostname;

    public EchoController(Clock clock) {
        this(clock, resolveHostname());
    }

    EchoController(Clock clock, String hostname) {
        this.clock = clock;
        this.hostname = hostname;
    }

    @GetMapping(value = "/**", produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> echo(HttpServletRequest request) {
        var clientIp = request.getRemoteAddr();
        var path = requestedPath(request);
        var serverTime = LocalDateTime.now(clock).format(TIME_FORMAT);

        log.info("Received request from {} - Path: {}", clientIp, path);

        var body = """
                <html>
                <head>
                    <title>Simple HTTP Server</title>
                </head>
                <body>
                    <h1>Hello from the Server!</h1>
                    <p>Your IP: %s</p>
                    <p>Requested path: %s</p>
                    <p>Server time: %s</p>
                    <p>Server hostname: %s</p>
                </body>
                </html>
                """.formatted(
                HtmlUtils.htmlEscape(clientIp),
                HtmlUtils.htmlEscape(path),
                serverTime,
                HtmlUtils.htmlEscape(hostname));

        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(body);
    }

    private static String requestedPath(HttpServletRequest request) {
        var query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local hostname: {}", e.getMessage());
            return "unknown";
        }
    }
}
