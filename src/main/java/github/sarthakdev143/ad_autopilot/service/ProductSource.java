package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.autopilot.ProductListing;

import java.util.List;

public interface ProductSource {

    List<ProductListing> listActiveProducts(String storeId);
}
