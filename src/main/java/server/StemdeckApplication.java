package server;

import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import server.rpc.ClientApi;
import server.rpc.ClientGateway;
import server.rpc.JsonRpcService;

@Slf4j
@SpringBootApplication(scanBasePackages = {"server"}, proxyBeanMethods = false)
public class StemdeckApplication {

    public static void main(String[] args) throws Exception {
        var ctx = SpringApplication.run(StemdeckApplication.class, args);

        var socketHandler = ctx.getBean(UnixSocketHandler.class);
        socketHandler.createUnixSocket();
        Runtime.getRuntime().addShutdownHook(new Thread(socketHandler::cleanup));

        log.info("Waiting for connection on Unix socket {}...", socketHandler.getSocketPath());
        while (!socketHandler.awaitClient(1, TimeUnit.SECONDS)) {
            log.trace("Still waiting for a client");
        }

        var rpc = ctx.getBean(JsonRpcService.class);
        Launcher<ClientApi> launcher =
                new Launcher.Builder<ClientApi>()
                        .setLocalService(rpc)
                        .setRemoteInterface(ClientApi.class)
                        .setInput(socketHandler.getInputStream())
                        .setOutput(socketHandler.getOutputStream())
                        .create();
        ctx.getBean(ClientGateway.class).setClient(launcher.getRemoteProxy());

        log.info("JSON-RPC server connected via {}", socketHandler.getSocketPath());
        launcher.startListening().get();
    }
}
