package com.longevitydigest.backend.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * PubMed E-utilities: esearch for ids, then efetch for article XML.
 */
@Slf4j
public class PubMedSourceAdapter extends AbstractSourceAdapter {

    private static final DateTimeFormatter PUBMED_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final int MAX_AUTHORS = 5;

    public PubMedSourceAdapter(PipelineProperties.Sources sourcesConfig) {
        super(sourcesConfig);
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.PUBMED;
    }

    @Override
    protected List<Candidate> doFetch(String query, int maxResults, DateWindow window) throws IOException {
        Map<String, String> searchParams = new LinkedHashMap<>();
        searchParams.put("db", "pubmed");
        searchParams.put("term", buildTerm(query, window));
        searchParams.put("retmax", String.valueOf(maxResults));
        searchParams.put("retmode", "json");
        searchParams.put("sort", "relevance");

        List<String> ids = parseIdList(httpGet(sourcesConfig.getPubmedBaseUrl() + "/esearch.fcgi", searchParams));
        if (ids.isEmpty()) {
            return List.of();
        }

        Map<String, String> fetchParams = new LinkedHashMap<>();
        fetchParams.put("db", "pubmed");
        fetchParams.put("id", String.join(",", ids));
        fetchParams.put("retmode", "xml");

        return parseArticles(httpGet(sourcesConfig.getPubmedBaseUrl() + "/efetch.fcgi", fetchParams));
    }

    static String buildTerm(String query, DateWindow window) {
        return "(" + query + ") AND "
                + window.getFrom().format(PUBMED_DATE) + ":" + window.getTo().format(PUBMED_DATE) + "[dp]";
    }

    List<String> parseIdList(String json) throws IOException {
        JsonNode idList = MAPPER.readTree(json).path("esearchresult").path("idlist");
        List<String> ids = new ArrayList<>();
        for (JsonNode id : idList) {
            if (!id.asText("").isBlank()) {
                ids.add(id.asText());
            }
        }
        return ids;
    }

    List<Candidate> parseArticles(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<Candidate> candidates = new ArrayList<>();

        for (Element article : doc.select("PubmedArticle")) {
            Element medline = article.selectFirst("MedlineCitation");
            Element articleData = medline != null ? medline.selectFirst("Article") : null;
            if (articleData == null) {
                log.debug("Skipping PubMed record without MedlineCitation/Article");
                continue;
            }

            List<String> authors = new ArrayList<>();
            for (Element author : articleData.select("AuthorList > Author")) {
                String last = childText(author, "LastName");
                if (!last.isEmpty()) {
                    authors.add((last + " " + childText(author, "ForeName")).trim());
                }
                if (authors.size() == MAX_AUTHORS) {
                    break;
                }
            }

            String doi = "";
            for (Element location : articleData.select("ELocationID")) {
                if ("doi".equalsIgnoreCase(location.attr("EIdType"))) {
                    doi = location.text().trim();
                    break;
                }
            }

            String pmid = childText(medline, "PMID");
            Set<String> tags = new LinkedHashSet<>();
            tags.add(SourceKind.PUBMED.getTag());

            candidates.add(Candidate.builder()
                    .title(childText(articleData, "ArticleTitle"))
                    .authors(authors)
                    .abstractText(childText(articleData, "Abstract > AbstractText"))
                    .venue(childText(articleData, "Journal > Title"))
                    .identifier(doi)
                    .publishedDate(childText(medline, "DateCompleted > Year"))
                    .url(pmid.isEmpty() ? "" : "https://pubmed.ncbi.nlm.nih.gov/" + pmid + "/")
                    .tags(tags)
                    .build());
        }
        return candidates;
    }

    private static String childText(Element parent, String selector) {
        Element element = parent.selectFirst(selector);
        return element != null ? element.text().trim() : "";
    }
}
