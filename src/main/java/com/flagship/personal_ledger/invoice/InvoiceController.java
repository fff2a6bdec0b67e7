package com.flagship.personal_ledger.invoice;

import com.flagship.personal_ledger.invoice.dto.InvoiceResponse;
import com.flagship.personal_ledger.security.OwnerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceService invoiceService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<InvoiceResponse> upload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "extracted_text", required = false) String extractedText) throws IOException {
        Invoice invoice = invoiceService.register(OwnerContext.requireOwnerId(), file.getOriginalFilename(),
            file.getBytes(), extractedText);
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResponse.from(invoice));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getInvoice(OwnerContext.requireOwnerId(), id)));
    }
}
