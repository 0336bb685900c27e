package com.flagship.account_storage.contract;

import com.flagship.account_storage.contract.dto.InvocationRequest;
import com.flagship.account_storage.contract.dto.InvocationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST gateway to the account storage contract.
 *
 * - POST /api/contract/submit: run a function and commit its writes
 * - POST /api/contract/evaluate: run a function without committing
 * - GET /api/contract/functions: function names and their parameters
 */
@RestController
@RequestMapping("/api/contract")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    private final ContractInvoker invoker;
    private final AccountStorageContract contract;

    @PostMapping("/submit")
    public ResponseEntity<InvocationResponse> submit(@Valid @RequestBody InvocationRequest request) {
        log.info("Received submit request: function={}", request.getFunction());
        InvocationResult result = invoker.submit(request.getFunction(), argsOf(request));
        return ResponseEntity.ok(InvocationResponse.from(result));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<InvocationResponse> evaluate(@Valid @RequestBody InvocationRequest request) {
        log.debug("Received evaluate request: function={}", request.getFunction());
        InvocationResult result = invoker.evaluate(request.getFunction(), argsOf(request));
        return ResponseEntity.ok(InvocationResponse.from(result));
    }

    @GetMapping("/functions")
    public ResponseEntity<Map<String, List<String>>> functions() {
        Map<String, List<String>> signatures = new LinkedHashMap<>();
        contract.functionNames().forEach(name -> signatures.put(name, contract.parametersOf(name)));
        return ResponseEntity.ok(signatures);
    }

    private static List<String> argsOf(InvocationRequest request) {
        return request.getArgs() == null ? List.of() : request.getArgs();
    }
}
