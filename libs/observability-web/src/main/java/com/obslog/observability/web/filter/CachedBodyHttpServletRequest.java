package com.obslog.observability.web.filter;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;

/**
 * Request wrapper that drains the body exactly once and replays it from memory to every later
 * reader.
 *
 * <p>Form posts are the exception to draining: the container parses them into parameters on
 * first access, so the parameters are read first and the cached body is rebuilt from them. This
 * keeps {@link #getParameter(String)} working for downstream handlers.
 *
 * <p>Multipart requests must not be wrapped: the container parses parts from its own input
 * stream, which this wrapper would already have drained. Callers check {@link #isBufferable}.
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private static final String FORM_CONTENT_TYPE = MediaType.APPLICATION_FORM_URLENCODED_VALUE;
    private static final String MULTIPART_PREFIX = "multipart/";

    private final byte[] body;

    public CachedBodyHttpServletRequest(HttpServletRequest request) throws IOException {
        super(request);
        this.body = isFormPost(request) ? encodeParameters(request) : StreamUtils.copyToByteArray(request.getInputStream());
    }

    /**
     * Returns the request itself when it already caches its body, else a new caching wrapper.
     */
    public static CachedBodyHttpServletRequest of(HttpServletRequest request) throws IOException {
        if (request instanceof CachedBodyHttpServletRequest cached) {
            return cached;
        }
        return new CachedBodyHttpServletRequest(request);
    }

    /**
     * Whether the request body can be buffered without breaking the container's own body
     * parsing. False for {@code multipart/*} content.
     */
    public static boolean isBufferable(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType == null || !contentType.strip().toLowerCase(Locale.ROOT).startsWith(MULTIPART_PREFIX);
    }

    /** The buffered body; never null. */
    public byte[] getCachedBody() {
        return body;
    }

    @Override
    public ServletInputStream getInputStream() {
        return new CachedBodyInputStream(body);
    }

    @Override
    public BufferedReader getReader() {
        return new BufferedReader(new InputStreamReader(new ByteArrayInputStream(body), charset()));
    }

    @Override
    public int getContentLength() {
        return body.length;
    }

    @Override
    public long getContentLengthLong() {
        return body.length;
    }

    private Charset charset() {
        String encoding = getCharacterEncoding();
        return encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
    }

    private static boolean isFormPost(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType != null
                && contentType.toLowerCase(Locale.ROOT).contains(FORM_CONTENT_TYPE)
                && "POST".equalsIgnoreCase(request.getMethod());
    }

    private static byte[] encodeParameters(HttpServletRequest request) {
        Charset charset = request.getCharacterEncoding() != null
                ? Charset.forName(request.getCharacterEncoding())
                : StandardCharsets.UTF_8;
        StringBuilder encoded = new StringBuilder();
        for (Map.Entry<String, String[]> entry : request.getParameterMap().entrySet()) {
            for (String value : entry.getValue()) {
                if (encoded.length() > 0) {
                    encoded.append('&');
                }
                encoded.append(URLEncoder.encode(entry.getKey(), charset));
                if (value != null) {
                    encoded.append('=').append(URLEncoder.encode(value, charset));
                }
            }
        }
        return encoded.toString().getBytes(charset);
    }

    private static final class CachedBodyInputStream extends ServletInputStream {

        private final ByteArrayInputStream delegate;

        private CachedBodyInputStream(byte[] body) {
            this.delegate = new ByteArrayInputStream(body);
        }

        @Override
        public boolean isFinished() {
            return delegate.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener listener) {
            throw new UnsupportedOperationException("non-blocking reads are not supported on a cached body");
        }

        @Override
        public int read() {
            return delegate.read();
        }

        @Override
        public int read(byte[] b, int off, int len) {
            return delegate.read(b, off, len);
        }
    }
}
