package com.missioncontrol.dispatch.cli;

import com.missioncontrol.core.model.ApprovalStatus;
import com.missioncontrol.core.model.Plan;
import com.missioncontrol.core.model.ValidationException;
import com.missioncontrol.core.plan.PlanApprovalService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: mission-control plans [--workspace W] [--status S]
 * <p>
 * Reads plans straight from the record store; no server needs to be running.
 */
@Command(name = "plans", mixinStandardHelpOptions = true, description = "List agent plans")
@Component
public class PlansCommand implements Callable<Integer> {

    @Option(names = {"--workspace", "-w"}, description = "Workspace id (default: ${DEFAULT-VALUE})",
            defaultValue = "default")
    String workspace;

    @Option(names = {"--status", "-s"}, description = "pending, approved or rejected (default: ${DEFAULT-VALUE})",
            defaultValue = "pending")
    String status;

    private final PlanApprovalService planApprovalService;

    public PlansCommand(PlanApprovalService planApprovalService) {
        this.planApprovalService = planApprovalService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ApprovalStatus approvalStatus;
        try {
            approvalStatus = ApprovalStatus.fromWire(status);
        } catch (ValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        List<Plan> plans = planApprovalService.listPlans(workspace, approvalStatus);
        if (plans.isEmpty()) {
            ConsoleOutput.info("No " + status + " plans in workspace '" + workspace + "'");
            return 0;
        }

        ConsoleOutput.info(plans.size() + " " + status + " plan(s) in workspace '" + workspace + "'");
        for (Plan plan : plans) {
            System.out.println();
            ConsoleOutput.plan(plan);
        }
        return 0;
    }
}
