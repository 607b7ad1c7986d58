package uk.gegc.creditledger.features.overage.infra.stripe;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.InvoiceItem;
import com.stripe.net.RequestOptions;
import com.stripe.param.InvoiceItemCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.creditledger.features.overage.application.InvoiceCollaborator;
import uk.gegc.creditledger.features.overage.domain.exception.InvoiceCollaboratorUnavailableException;

@Slf4j
@Component
public class StripeInvoiceCollaborator implements InvoiceCollaborator {

    @Autowired(required = false)
    private StripeClient stripeClient;

    @Override
    public String createInvoiceItem(InvoiceItemRequest request) {
        if (stripeClient == null && !StringUtils.hasText(Stripe.apiKey)) {
            throw new InvoiceCollaboratorUnavailableException("Stripe is not configured (stripe.secret-key is empty)");
        }

        InvoiceItemCreateParams.Builder params = InvoiceItemCreateParams.builder()
                .setCustomer(request.customerId())
                .setAmount(request.amountMinorUnits())
                .setCurrency(request.currency())
                .setDescription(request.description());
        request.metadata().forEach(params::putMetadata);

        RequestOptions options = RequestOptions.builder()
                .setIdempotencyKey(request.idempotencyKey())
                .build();

        try {
            InvoiceItem item = (stripeClient != null)
                    ? stripeClient.invoiceItems().create(params.build(), options)
                    : InvoiceItem.create(params.build(), options);
            log.info("Created Stripe invoice item id={} customer={} amount={} {} key={}",
                    item.getId(), request.customerId(), request.amountMinorUnits(), request.currency(),
                    request.idempotencyKey());
            return item.getId();
        } catch (StripeException e) {
            log.error("Failed to create Stripe invoice item customer={} key={}: {}",
                    request.customerId(), request.idempotencyKey(), e.getMessage());
            throw new InvoiceCollaboratorUnavailableException("Stripe invoice item creation failed", e);
        }
    }
}
