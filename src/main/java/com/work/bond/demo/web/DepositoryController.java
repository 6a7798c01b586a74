package com.work.bond.demo.web;

import com.work.bond.demo.service.BondTellerService;
import com.work.bond.demo.web.dto.CreateTellerRequest;
import com.work.bond.demo.web.dto.TellerView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.work.bond.demo.web.TellerController.CALLER_HEADER;

/**
 * depository 管理接口：创建 teller、撤销 teller 授权。
 */
@RestController
@RequestMapping("/api/depository/tellers")
public class DepositoryController {

    private final BondTellerService tellerService;

    public DepositoryController(BondTellerService tellerService) {
        this.tellerService = tellerService;
    }

    @PostMapping
    public ResponseEntity<TellerView> create(@RequestHeader(CALLER_HEADER) String caller,
                                             @Validated @RequestBody CreateTellerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tellerService.createTeller(caller, request));
    }

    @DeleteMapping("/{teller}")
    public ResponseEntity<Void> remove(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String teller) {
        tellerService.removeTeller(caller, teller);
        return ResponseEntity.noContent().build();
    }
}
