package io.github.themoah.feedrace.geyser;

import io.github.themoah.feedrace.config.StreamConfig;
import io.github.themoah.feedrace.geyser.proto.SubscribeRequest;
import io.github.themoah.feedrace.geyser.proto.SubscribeUpdate;
import io.grpc.MethodDescriptor;
import io.grpc.protobuf.ProtoUtils;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpVersion;
import io.vertx.core.net.SocketAddress;
import io.vertx.grpc.client.GrpcClient;
import io.vertx.grpc.client.GrpcClientRequest;
import io.vertx.grpc.client.GrpcClientResponse;
import io.vertx.grpc.common.GrpcStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Yellowstone Geyser connector over the Vert.x gRPC client.
 * TLS is used for {@code https} endpoints, HTTP/2 prior knowledge otherwise.
 */
public class VertxGeyserConnector implements GeyserConnector {

  private static final Logger log = LoggerFactory.getLogger(VertxGeyserConnector.class);

  private static final String TOKEN_HEADER = "x-token";

  static final MethodDescriptor<SubscribeRequest, SubscribeUpdate> SUBSCRIBE_METHOD =
    MethodDescriptor.<SubscribeRequest, SubscribeUpdate>newBuilder()
      .setType(MethodDescriptor.MethodType.BIDI_STREAMING)
      .setFullMethodName(MethodDescriptor.generateFullMethodName("geyser.Geyser", "Subscribe"))
      .setRequestMarshaller(ProtoUtils.marshaller(SubscribeRequest.getDefaultInstance()))
      .setResponseMarshaller(ProtoUtils.marshaller(SubscribeUpdate.getDefaultInstance()))
      .build();

  private final StreamConfig config;
  private final SocketAddress address;
  private final GrpcClient client;

  public VertxGeyserConnector(Vertx vertx, StreamConfig config) {
    this.config = config;
    this.address = SocketAddress.inetSocketAddress(config.port(), config.host());
    this.client = GrpcClient.client(vertx, createHttpOptions(config));
  }

  static HttpClientOptions createHttpOptions(StreamConfig config) {
    HttpClientOptions options = new HttpClientOptions()
      .setProtocolVersion(HttpVersion.HTTP_2)
      .setHttp2ClearTextUpgrade(false);
    if (config.usesTls()) {
      options.setSsl(true)
        .setUseAlpn(true)
        .setForceSni(true);
    }
    return options;
  }

  @Override
  public Future<GeyserSession> subscribe(SubscribeRequest request) {
    log.debug("[{}] Opening Subscribe call to {}", config.name(), address);

    return client.request(address, SUBSCRIBE_METHOD)
      .compose(call -> {
        config.token().ifPresent(token -> call.headers().set(TOKEN_HEADER, token));
        return call.write(request)
          .compose(v -> call.response())
          .compose(response -> {
            GrpcStatus status = response.status();
            if (status != null && status != GrpcStatus.OK) {
              call.cancel();
              return Future.failedFuture(new GeyserException(
                "Subscription rejected with status " + status));
            }
            return Future.succeededFuture((GeyserSession) new VertxGeyserSession(call, response));
          });
      });
  }

  @Override
  public Future<Void> close() {
    return client.close();
  }

  private static final class VertxGeyserSession implements GeyserSession {

    private final GrpcClientRequest<SubscribeRequest, SubscribeUpdate> call;
    private final GrpcClientResponse<SubscribeRequest, SubscribeUpdate> response;
    private boolean closed;

    private VertxGeyserSession(
      GrpcClientRequest<SubscribeRequest, SubscribeUpdate> call,
      GrpcClientResponse<SubscribeRequest, SubscribeUpdate> response
    ) {
      this.call = call;
      this.response = response;
    }

    @Override
    public GeyserSession handler(Handler<SubscribeUpdate> handler) {
      response.handler(handler);
      return this;
    }

    @Override
    public GeyserSession exceptionHandler(Handler<Throwable> handler) {
      response.exceptionHandler(handler);
      return this;
    }

    @Override
    public GeyserSession endHandler(Handler<Void> handler) {
      response.endHandler(handler);
      return this;
    }

    @Override
    public Future<Void> send(SubscribeRequest request) {
      return call.write(request);
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        call.cancel();
      }
    }
  }
}
