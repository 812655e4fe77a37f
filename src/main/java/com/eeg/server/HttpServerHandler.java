package com.eeg.server;

import com.eeg.service.IngestResult;
import com.eeg.service.IngestionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Обработчик HTTP-запросов для приёма EEG-блоков от устройств.
 * <p>
 * Делегирует обработку сервису {@link IngestionService} и переводит результат в HTTP-статус.
 * Клиент никогда не получает внутренних подробностей ошибок БД или брокера.
 */
@ChannelHandler.Sharable
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  static final String UPLOAD_PATH = "/upload/eeg";
  static final String HEALTH_PATH = "/health";

  private final IngestionService ingestionService;
  private final ObjectMapper objectMapper;

  /**
   * Конструктор обработчика.
   *
   * @param ingestionService Сервис приёма блоков.
   */
  public HttpServerHandler(IngestionService ingestionService) {
    this.ingestionService = ingestionService;
    this.objectMapper = new ObjectMapper();
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    String path = new QueryStringDecoder(request.uri()).path();
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, path);

    FullHttpResponse response;
    if (method == HttpMethod.POST && UPLOAD_PATH.equals(path)) {
      response = handleUpload(request);
    } else if (method == HttpMethod.GET && HEALTH_PATH.equals(path)) {
      response = createJsonResponse(HttpResponseStatus.OK, status("ok"));
    } else {
      response = createJsonResponse(HttpResponseStatus.NOT_FOUND, error("Not found"));
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse handleUpload(FullHttpRequest request) {
    IngestRequest data;
    try {
      String body = request.content().toString(CharsetUtil.UTF_8);
      data = objectMapper.readValue(body, IngestRequest.class);
    } catch (JsonProcessingException e) {
      logger.info("Некорректное тело запроса: {}", e.getOriginalMessage());
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("Invalid request body"));
    }
    if (data == null) {
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("Invalid request body"));
    }

    IngestResult result;
    try {
      result = ingestionService.ingest(data);
    } catch (RuntimeException e) {
      logger.error("❌ Непредвиденная ошибка при обработке блока", e);
      return internalError();
    }

    switch (result.getOutcome()) {
      case STORED:
      case STORED_NOTIFICATION_FAILED: {
        ObjectNode body = status("ok");
        body.put("inserted_records", result.getInsertedRecords());
        return createJsonResponse(HttpResponseStatus.CREATED, body);
      }
      case EMPTY: {
        ObjectNode body = status("ok");
        body.put("message", "No data to insert.");
        return createJsonResponse(HttpResponseStatus.OK, body);
      }
      case VALIDATION_FAILED: {
        ObjectNode body = error("Missing required fields");
        ArrayNode fields = body.putArray("fields");
        result.getInvalidFields().forEach(fields::add);
        return createJsonResponse(HttpResponseStatus.BAD_REQUEST, body);
      }
      default:
        return internalError();
    }
  }

  private FullHttpResponse internalError() {
    return createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, error("An internal server error occurred"));
  }

  private ObjectNode status(String status) {
    return objectMapper.createObjectNode().put("status", status);
  }

  private ObjectNode error(String message) {
    return objectMapper.createObjectNode().put("error", message);
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, ObjectNode body) {
    byte[] bytes;
    try {
      bytes = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Не удалось сериализовать ответ", e);
    }
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.wrappedBuffer(bytes)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("Ошибка канала {}", ctx.channel(), cause);
    ctx.close();
  }
}
