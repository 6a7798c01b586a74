package com.work.bond.demo.web;

import com.work.bond.demo.service.BondTellerService;
import com.work.bond.demo.web.dto.FeesRequest;
import com.work.bond.demo.web.dto.TellerView;
import com.work.bond.demo.web.dto.TermsRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.work.bond.demo.web.TellerController.CALLER_HEADER;

/**
 * 治理方使用的 teller 管理接口，权限由核心组件按 X-Caller 校验。
 */
@RestController
@RequestMapping("/api/tellers/{teller}")
public class TellerAdminController {

    private final BondTellerService tellerService;

    public TellerAdminController(BondTellerService tellerService) {
        this.tellerService = tellerService;
    }

    @PutMapping("/terms")
    public ResponseEntity<TellerView> setTerms(@PathVariable String teller,
                                               @RequestHeader(CALLER_HEADER) String caller,
                                               @Validated @RequestBody TermsRequest request) {
        return ResponseEntity.ok(tellerService.setTerms(teller, caller, request));
    }

    @PutMapping("/fees")
    public ResponseEntity<TellerView> setFees(@PathVariable String teller,
                                              @RequestHeader(CALLER_HEADER) String caller,
                                              @Validated @RequestBody FeesRequest request) {
        return ResponseEntity.ok(tellerService.setFees(teller, caller, request.getProtocolFeeBps()));
    }

    @PostMapping("/pause")
    public ResponseEntity<TellerView> pause(@PathVariable String teller,
                                            @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(tellerService.pause(teller, caller));
    }

    @PostMapping("/unpause")
    public ResponseEntity<TellerView> unpause(@PathVariable String teller,
                                              @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(tellerService.unpause(teller, caller));
    }
}
