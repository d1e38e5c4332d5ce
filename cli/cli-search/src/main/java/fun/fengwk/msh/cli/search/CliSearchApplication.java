package fun.fengwk.msh.cli.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.msh")
public class CliSearchApplication {

    public static void main(String[] args) {
        // close the context, and the browser workers with it, once the runner is done
        System.exit(SpringApplication.exit(SpringApplication.run(CliSearchApplication.class, args)));
    }

}
