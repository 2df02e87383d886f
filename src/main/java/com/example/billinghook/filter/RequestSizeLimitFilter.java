package com.example.billinghook.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 限制 /hooks/** 请求体大小（默认 2MB）。
 * 除检查 Content-Length 外，还包装输入流按实际读取字节数计数，分块传输同样受限。
 */
@Component
@Slf4j
public class RequestSizeLimitFilter extends OncePerRequestFilter {

    static final long MAX_REQUEST_SIZE = 2 * 1024 * 1024;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/hooks/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long contentLength = request.getContentLengthLong();
        if (contentLength > MAX_REQUEST_SIZE) {
            log.warn("Rejected request to {} with Content-Length {}", request.getRequestURI(), contentLength);
            reject(response);
            return;
        }

        try {
            chain.doFilter(new SizeLimitedRequest(request, MAX_REQUEST_SIZE), response);
        } catch (SizeLimitExceededException e) {
            log.warn("Request body to {} exceeded limit after {} bytes", request.getRequestURI(), e.getBytesRead());
            if (!response.isCommitted()) {
                reject(response);
            }
        }
    }

    private static void reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"Payload too large\"}");
    }

    public static class SizeLimitExceededException extends RuntimeException {
        private final long bytesRead;

        SizeLimitExceededException(long bytesRead) {
            super("Request size exceeded limit");
            this.bytesRead = bytesRead;
        }

        public long getBytesRead() {
            return bytesRead;
        }
    }

    private static class SizeLimitedRequest extends HttpServletRequestWrapper {
        private final long maxBytes;
        private ServletInputStream inputStream;
        private BufferedReader reader;

        SizeLimitedRequest(HttpServletRequest request, long maxBytes) {
            super(request);
            this.maxBytes = maxBytes;
        }

        @Override
        public ServletInputStream getInputStream() throws IOException {
            if (inputStream == null) {
                inputStream = new SizeLimitedInputStream(super.getInputStream(), maxBytes);
            }
            return inputStream;
        }

        @Override
        public BufferedReader getReader() throws IOException {
            if (reader == null) {
                String encoding = getCharacterEncoding();
                Charset charset = encoding == null ? StandardCharsets.UTF_8 : Charset.forName(encoding);
                reader = new BufferedReader(new InputStreamReader(getInputStream(), charset));
            }
            return reader;
        }
    }

    private static class SizeLimitedInputStream extends ServletInputStream {
        private final ServletInputStream delegate;
        private final long maxBytes;
        private long bytesRead;

        SizeLimitedInputStream(ServletInputStream delegate, long maxBytes) {
            this.delegate = delegate;
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            int b = delegate.read();
            if (b != -1) {
                count(1);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            if (n > 0) {
                count(n);
            }
            return n;
        }

        private void count(int n) {
            bytesRead += n;
            if (bytesRead > maxBytes) {
                throw new SizeLimitExceededException(bytesRead);
            }
        }

        @Override
        public boolean isFinished() {
            return delegate.isFinished();
        }

        @Override
        public boolean isReady() {
            return delegate.isReady();
        }

        @Override
        public void setReadListener(ReadListener listener) {
            delegate.setReadListener(listener);
        }
    }
}
