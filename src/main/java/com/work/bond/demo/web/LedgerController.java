package com.work.bond.demo.web;

import com.work.bond.demo.service.BondTellerService;
import com.work.bond.demo.web.dto.ApproveRequest;
import com.work.bond.demo.web.dto.FaucetRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

import static com.work.bond.demo.web.TellerController.CALLER_HEADER;

/**
 * demo 用内存账本接口：查询余额、领取测试资产、授权。
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final BondTellerService tellerService;

    public LedgerController(BondTellerService tellerService) {
        this.tellerService = tellerService;
    }

    @GetMapping("/{asset}/balances/{holder}")
    public ResponseEntity<BigInteger> balance(@PathVariable String asset, @PathVariable String holder) {
        return ResponseEntity.ok(tellerService.balanceOf(asset, holder));
    }

    @PostMapping("/faucet")
    public ResponseEntity<BigInteger> faucet(@Validated @RequestBody FaucetRequest request) {
        return ResponseEntity.ok(tellerService.faucet(request.getAsset(), request.getHolder(), request.getAmount()));
    }

    @PostMapping("/approve")
    public ResponseEntity<Void> approve(@RequestHeader(CALLER_HEADER) String caller,
                                        @Validated @RequestBody ApproveRequest request) {
        tellerService.approve(caller, request.getAsset(), request.getSpender(), request.getAmount());
        return ResponseEntity.noContent().build();
    }
}
