package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlTaskException;
import com.dharmil.catalogcrawl.model.ProductDetail;

public interface ProductPersister {

    void persist(ProductDetail detail) throws CrawlTaskException;
}
