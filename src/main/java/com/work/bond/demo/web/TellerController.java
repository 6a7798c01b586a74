package com.work.bond.demo.web;

import com.work.bond.demo.service.BondTellerService;
import com.work.bond.demo.web.dto.BondView;
import com.work.bond.demo.web.dto.ClaimResponse;
import com.work.bond.demo.web.dto.DepositRequest;
import com.work.bond.demo.web.dto.DepositResponse;
import com.work.bond.demo.web.dto.QuoteResponse;
import com.work.bond.demo.web.dto.ReceiveRequest;
import com.work.bond.demo.web.dto.SignedDepositRequest;
import com.work.bond.demo.web.dto.TellerView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * 面向购买者的 REST API：报价、存款、领取与债券查询。
 * 调用方身份取自 X-Caller 请求头（认证不在本服务范围内）。
 */
@RestController
@RequestMapping("/api/tellers")
public class TellerController {

    static final String CALLER_HEADER = "X-Caller";

    private final BondTellerService tellerService;

    public TellerController(BondTellerService tellerService) {
        this.tellerService = tellerService;
    }

    @GetMapping
    public ResponseEntity<List<TellerView>> list() {
        return ResponseEntity.ok(tellerService.listTellers());
    }

    @GetMapping("/{teller}")
    public ResponseEntity<TellerView> get(@PathVariable String teller) {
        return ResponseEntity.ok(tellerService.getTeller(teller));
    }

    @GetMapping("/{teller}/quote/out")
    public ResponseEntity<QuoteResponse> quoteOut(@PathVariable String teller,
                                                  @RequestParam("amountIn") BigInteger amountIn,
                                                  @RequestParam(value = "stake", defaultValue = "false") boolean stake) {
        return ResponseEntity.ok(tellerService.quoteOut(teller, amountIn, stake));
    }

    @GetMapping("/{teller}/quote/in")
    public ResponseEntity<QuoteResponse> quoteIn(@PathVariable String teller,
                                                 @RequestParam("amountOut") BigInteger amountOut,
                                                 @RequestParam(value = "stake", defaultValue = "false") boolean stake) {
        return ResponseEntity.ok(tellerService.quoteIn(teller, amountOut, stake));
    }

    @PostMapping("/{teller}/deposits")
    public ResponseEntity<DepositResponse> deposit(@PathVariable String teller,
                                                   @RequestHeader(CALLER_HEADER) String caller,
                                                   @Validated @RequestBody DepositRequest request) {
        return ResponseEntity.ok(tellerService.deposit(teller, caller, request));
    }

    @PostMapping("/{teller}/deposits/signed")
    public ResponseEntity<DepositResponse> depositSigned(@PathVariable String teller,
                                                         @RequestHeader(CALLER_HEADER) String caller,
                                                         @Validated @RequestBody SignedDepositRequest request) {
        return ResponseEntity.ok(tellerService.depositSigned(teller, caller, request));
    }

    @PostMapping("/{teller}/receive")
    public ResponseEntity<DepositResponse> receive(@PathVariable String teller,
                                                   @RequestHeader(CALLER_HEADER) String caller,
                                                   @Validated @RequestBody ReceiveRequest request) {
        return ResponseEntity.ok(tellerService.receive(teller, caller, request.getAmount()));
    }

    @PostMapping("/{teller}/bonds/{bondId}/claim")
    public ResponseEntity<ClaimResponse> claim(@PathVariable String teller,
                                               @PathVariable long bondId,
                                               @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(tellerService.claim(teller, caller, bondId));
    }

    @GetMapping("/{teller}/bonds/{bondId}")
    public ResponseEntity<BondView> bond(@PathVariable String teller, @PathVariable long bondId) {
        return ResponseEntity.ok(tellerService.getBond(teller, bondId));
    }

    @GetMapping("/{teller}/bonds")
    public ResponseEntity<List<BondView>> bonds(@PathVariable String teller, @RequestParam("owner") String owner) {
        return ResponseEntity.ok(tellerService.listBonds(teller, owner));
    }
}
