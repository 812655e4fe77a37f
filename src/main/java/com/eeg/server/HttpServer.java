package com.eeg.server;

import com.eeg.codec.PacketDecoder;
import com.eeg.compress.ZstdDecompressor;
import com.eeg.config.Config;
import com.eeg.db.DatabaseConnection;
import com.eeg.db.SampleDao;
import com.eeg.mq.RabbitMqNotificationPublisher;
import com.eeg.service.IngestionService;
import com.eeg.service.IngestionServiceImpl;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Главный класс приложения. Запускает HTTP-сервер на Netty.
 * <p>
 * Обработка блока блокирует поток (JDBC, RabbitMQ), поэтому обработчик работает
 * в отдельной группе потоков, а не в event loop.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private final int port;
  private final IngestionService ingestionService;
  private final int workerThreads;
  private final int maxContentLength;

  private volatile Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   * @param port Порт, на котором будет работать сервер.
   * @param ingestionService Сервис приёма блоков.
   * @param workerThreads Размер группы потоков для обработки запросов.
   * @param maxContentLength Максимальный размер тела запроса в байтах.
   */
  public HttpServer(int port, IngestionService ingestionService, int workerThreads, int maxContentLength) {
    this.port = port;
    this.ingestionService = ingestionService;
    this.workerThreads = workerThreads;
    this.maxContentLength = maxContentLength;
  }

  /**
   * Запускает сервер и ожидает завершения.
   * @throws InterruptedException если поток прерван во время ожидания.
   */
  public void start() throws InterruptedException {
    EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    EventExecutorGroup ingestGroup = new DefaultEventExecutorGroup(workerThreads);
    HttpServerHandler handler = new HttpServerHandler(ingestionService);
    try {
      ServerBootstrap b = new ServerBootstrap();
      b.group(bossGroup, workerGroup)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
              ch.pipeline()
                  .addLast(new HttpServerCodec())
                  .addLast(new HttpObjectAggregator(maxContentLength))
                  .addLast(ingestGroup, handler);
            }
          })
          .option(ChannelOption.SO_BACKLOG, 128)
          .childOption(ChannelOption.SO_KEEPALIVE, true);

      ChannelFuture f = b.bind(port).sync();
      serverChannel = f.channel();
      logger.info("🚀 Сервер запущен на http://0.0.0.0:{}", port);
      f.channel().closeFuture().sync();
    } finally {
      ingestGroup.shutdownGracefully();
      workerGroup.shutdownGracefully();
      bossGroup.shutdownGracefully();
    }
  }

  /**
   * Закрывает серверный канал; {@link #start()} после этого завершается.
   */
  public void stop() {
    Channel channel = serverChannel;
    if (channel != null) {
      channel.close();
    }
  }

  /**
   * Точка входа в приложение.
   * Создаёт пул БД и таблицу, инициализирует zstd до открытия порта и запускает сервер.
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    DatabaseConnection database = DatabaseConnection.fromConfig();
    Runtime.getRuntime().addShutdownHook(new Thread(database::close, "db-pool-shutdown"));
    database.initializeDatabase(Config.getBooleanProperty("db.timescale.enabled", false));

    ZstdDecompressor decompressor = new ZstdDecompressor(
        Long.parseLong(Config.getProperty("compression.max.decompressed.bytes", "67108864")));
    decompressor.initialize();

    IngestionService service = new IngestionServiceImpl(
        decompressor,
        new PacketDecoder(),
        new SampleDao(database),
        RabbitMqNotificationPublisher.fromConfig(),
        Clock.systemUTC());

    new HttpServer(
        Config.getIntProperty("server.port", 6000),
        service,
        Config.getIntProperty("server.worker.threads", 16),
        Config.getIntProperty("server.max.content.length", 10 * 1024 * 1024)
    ).start();
  }
}
