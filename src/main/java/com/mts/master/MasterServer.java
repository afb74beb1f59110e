package com.mts.master;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mts.common.status.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * JSON-lines TCP front end of the master: every request is one JSON object on
 * one line, answered by one JSON object on one line. Connections are served by
 * a bounded worker pool and may carry any number of requests.
 */
public class MasterServer {
    private static final Logger logger = LoggerFactory.getLogger(MasterServer.class);
    private static final TypeReference<Map<String, Object>> REQUEST_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final int port;                         // 监听端口，0 表示随机端口
    private final AdminFacade adminFacade;
    private final ExecutorService threadPool;       // 处理连接的线程池
    private final ObjectMapper mapper = new ObjectMapper();

    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public MasterServer(int port, int workers, AdminFacade adminFacade) {
        this.port = port;
        this.adminFacade = adminFacade;
        this.threadPool = Executors.newFixedThreadPool(workers);
    }

    /**
     * Binds the port and starts accepting connections in the background.
     */
    public void start() throws IOException {
        serverSocket = new ServerSocket(port);
        logger.info("MasterServer 启动监听端口 {}", serverSocket.getLocalPort());

        acceptThread = new Thread(this::acceptLoop, "master-server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    public void stop() {
        try {
            if (serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            logger.error("关闭 MasterServer 出错: {}", e.getMessage(), e);
        }
        threadPool.shutdownNow();   // 中断仍在读取的连接
        try {
            if (!threadPool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("部分连接处理线程未能及时退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("MasterServer 已关闭");
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();      // 接收到新的连接
                logger.debug("接收到新的连接: {}", socket.getRemoteSocketAddress());
                try {
                    threadPool.submit(() -> handleConnection(socket));
                } catch (RejectedExecutionException e) {
                    logger.warn("线程池已关闭, 拒绝连接 {}", socket.getRemoteSocketAddress());
                    closeSocket(socket);
                }
            } catch (SocketException e) {
                if (!serverSocket.isClosed()) {
                    logger.error("接收连接失败: {}", e.getMessage(), e);
                }
            } catch (IOException e) {
                logger.error("接收连接失败: {}", e.getMessage(), e);
            }
        }
    }

    // 逐行解析请求并返回响应
    private void handleConnection(Socket socket) {
        try (
                BufferedReader in = new BufferedReader(
                        new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                PrintWriter out = new PrintWriter(socket.getOutputStream(), true, StandardCharsets.UTF_8)
        ) {
            String requestLine;
            while ((requestLine = in.readLine()) != null) {
                if (requestLine.trim().isEmpty()) {
                    continue;
                }
                out.println(process(requestLine));
            }
        } catch (IOException e) {
            logger.warn("处理连接 {} 失败: {}", socket.getRemoteSocketAddress(), e.getMessage());
        } finally {
            closeSocket(socket);
        }
    }

    String process(String requestLine) throws JsonProcessingException {
        Map<String, Object> response;
        try {
            Map<String, Object> request = mapper.readValue(requestLine, REQUEST_TYPE);
            response = adminFacade.handle(request);
        } catch (JsonProcessingException e) {
            response = AdminFacade.errorResponse(StatusCode.INVALID_ARGUMENT, "Invalid JSON request: "
                    + e.getOriginalMessage());
        } catch (RuntimeException e) {
            logger.error("处理请求失败: {}", requestLine, e);
            response = AdminFacade.errorResponse(StatusCode.INTERNAL, "Request failed: " + e.getMessage());
        }
        return mapper.writeValueAsString(response);
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.warn("关闭 socket 出错: {}", e.getMessage());
        }
    }
}
