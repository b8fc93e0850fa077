package io.github.drompincen.devicebridge.device;

import io.github.drompincen.devicebridge.device.agent.DeviceAgentService;
import io.github.drompincen.devicebridge.device.client.BridgeClient;
import io.github.drompincen.devicebridge.runtime.agent.AbortSignal;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Connects to the hub, or with {@code --task="..."} runs that one task locally and prints the
 * result.
 */
@Component
public class DeviceLauncher implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DeviceLauncher.class);

    private final BridgeClient client;
    private final DeviceAgentService agent;
    private final PrintStream out;
    private volatile boolean standalone;

    public DeviceLauncher(BridgeClient client, DeviceAgentService agent) {
        this(client, agent, System.out);
    }

    DeviceLauncher(BridgeClient client, DeviceAgentService agent, PrintStream out) {
        this.client = client;
        this.agent = agent;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> task = args.getOptionValues("task");
        if (task == null || task.isEmpty()) {
            client.start();
            return;
        }
        standalone = true;
        String text = String.join(" ", task);
        log.info("[device] standalone mode");
        AgentRunListener console = new AgentRunListener() {
            @Override public void onLog(String line) { log.info(line); }
        };
        out.println(agent.runTask(text, console, AbortSignal.none()));
    }

    public boolean isStandalone() {
        return standalone;
    }
}
